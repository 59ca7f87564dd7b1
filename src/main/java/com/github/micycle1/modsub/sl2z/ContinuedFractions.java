package com.github.micycle1.modsub.sl2z;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * <p>
 * Nearest-integer continued fractions
 * {@code x = n0 - 1/(n1 - 1/(n2 - ...))}, generated by
 * {@code n_k = round(x_k)} and {@code x_{k+1} = -1/(x_k - n_k)}, with rounding
 * as in {@link NearestInteger}.
 * </p>
 *
 * <p>
 * Rational input terminates when the remainder vanishes; real input stops
 * after a bounded number of terms.
 * </p>
 */
public final class ContinuedFractions {

	public static final int MAX_RATIONAL_TERMS = 10000;
	public static final int DEFAULT_REAL_TERMS = 100;

	private ContinuedFractions() {
	}

	/**
	 * Expansion of {@code p/q}.
	 *
	 * @throws FactorizationException if more than {@link #MAX_RATIONAL_TERMS}
	 *                                terms are needed
	 */
	public static BigInteger[] ofRational(BigInteger p, BigInteger q) {
		if (q.signum() == 0) {
			throw new ArithmeticException("Zero denominator");
		}
		List<BigInteger> terms = new ArrayList<>();
		while (true) {
			if (terms.size() >= MAX_RATIONAL_TERMS) {
				throw new FactorizationException("Continued fraction of " + p + "/" + q + " exceeds "
						+ MAX_RATIONAL_TERMS + " terms");
			}
			BigInteger n = NearestInteger.round(p, q);
			terms.add(n);
			BigInteger rem = p.subtract(n.multiply(q));
			if (rem.signum() == 0) {
				break;
			}
			// -1 / (rem/q) = -q/rem
			BigInteger np = q.negate();
			q = rem;
			p = np;
		}
		return terms.toArray(new BigInteger[0]);
	}

	/** Expansion of {@code p/q} for machine-size input. */
	public static long[] ofRational(long p, long q) {
		BigInteger[] terms = ofRational(BigInteger.valueOf(p), BigInteger.valueOf(q));
		long[] out = new long[terms.length];
		for (int k = 0; k < terms.length; k++) {
			out[k] = terms[k].longValueExact();
		}
		return out;
	}

	public static long[] ofReal(double x) {
		return ofRealTerms(x, DEFAULT_REAL_TERMS);
	}

	public static long[] ofRealTerms(double x, int maxTerms) {
		List<Long> terms = new ArrayList<>();
		while (terms.size() < maxTerms) {
			long n = NearestInteger.round(x);
			terms.add(n);
			double r = x - n;
			if (r == 0.0) {
				break;
			}
			x = -1.0 / r;
			if (Math.abs(x) >= Long.MAX_VALUE / 2.0) {
				break;
			}
		}
		return toArray(terms);
	}

	/**
	 * Expansion of a real in working precision {@code mc}. Stops at
	 * {@code maxTerms}, or once the remainder is below the working precision.
	 */
	public static long[] ofReal(BigDecimal x, int maxTerms, MathContext mc) {
		BigDecimal eps = BigDecimal.ONE.movePointLeft(Math.max(1, mc.getPrecision() - 2));
		BigDecimal bound = BigDecimal.valueOf(Long.MAX_VALUE / 2);
		List<Long> terms = new ArrayList<>();
		while (terms.size() < maxTerms) {
			long n = NearestInteger.round(x).longValueExact();
			terms.add(n);
			BigDecimal r = x.subtract(BigDecimal.valueOf(n), mc);
			if (r.abs().compareTo(eps) < 0) {
				break;
			}
			x = BigDecimal.ONE.negate().divide(r, mc);
			if (x.abs().compareTo(bound) > 0) {
				break;
			}
		}
		return toArray(terms);
	}

	/** Value of a finite expansion as a cusp (infinity when a tail vanishes). */
	public static Cusp evaluate(long[] terms) {
		if (terms.length == 0) {
			throw new IllegalArgumentException("Empty continued fraction");
		}
		// value = p/q, folded from the back: n - 1/(p/q) = (n*p - q)/p
		long p = terms[terms.length - 1];
		long q = 1;
		for (int k = terms.length - 2; k >= 0; k--) {
			long np = Math.subtractExact(Math.multiplyExact(terms[k], p), q);
			q = p;
			p = np;
		}
		return Cusp.of(p, q);
	}

	private static long[] toArray(List<Long> terms) {
		return terms.stream().mapToLong(Long::longValue).toArray();
	}
}
