package com.github.micycle1.modsub.sl2z;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Nearest-integer rounding with exact halves rounded toward zero, so that
 * {@code 1/2 → 0} and {@code -1/2 → 0}.
 */
public final class NearestInteger {

	private NearestInteger() {
	}

	/** Nearest integer to the rational {@code p/q}, {@code q != 0}. */
	public static long round(long p, long q) {
		if (q == 0) {
			throw new ArithmeticException("Zero denominator");
		}
		if (q < 0) {
			p = Math.negateExact(p);
			q = -q;
		}
		long fl = Math.floorDiv(p, q);
		long twiceRem = Math.multiplyExact(p - fl * q, 2);
		if (twiceRem < q) {
			return fl;
		}
		if (twiceRem > q) {
			return fl + 1;
		}
		return fl >= 0 ? fl : fl + 1;
	}

	public static long round(double x) {
		if (!Double.isFinite(x) || Math.abs(x) >= 0x1p62) {
			throw new ArithmeticException("Cannot round " + x + " to a long");
		}
		double fl = Math.floor(x);
		double r = x - fl;
		long n = (long) fl;
		if (r < 0.5) {
			return n;
		}
		if (r > 0.5) {
			return n + 1;
		}
		return n >= 0 ? n : n + 1;
	}

	/** Nearest integer to the rational {@code p/q}, {@code q != 0}. */
	public static BigInteger round(BigInteger p, BigInteger q) {
		if (q.signum() == 0) {
			throw new ArithmeticException("Zero denominator");
		}
		if (q.signum() < 0) {
			p = p.negate();
			q = q.negate();
		}
		BigInteger[] qr = p.divideAndRemainder(q);
		BigInteger fl = qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
		int cmp = p.subtract(fl.multiply(q)).shiftLeft(1).compareTo(q);
		if (cmp < 0) {
			return fl;
		}
		if (cmp > 0) {
			return fl.add(BigInteger.ONE);
		}
		return fl.signum() >= 0 ? fl : fl.add(BigInteger.ONE);
	}

	public static BigInteger round(BigDecimal x) {
		return x.setScale(0, RoundingMode.HALF_DOWN).toBigIntegerExact();
	}
}
