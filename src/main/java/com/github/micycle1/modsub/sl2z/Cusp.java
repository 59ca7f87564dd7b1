package com.github.micycle1.modsub.sl2z;

import java.math.BigInteger;

/**
 * A point of the projective rational line: a reduced fraction p/q with
 * {@code q > 0}, or infinity stored as {@code 1/0}.
 */
public final class Cusp {

	public static final Cusp INFINITY = new Cusp(1, 0);
	public static final Cusp ZERO = new Cusp(0, 1);

	public final long p;
	public final long q;

	private Cusp(long p, long q) {
		this.p = p;
		this.q = q;
	}

	/**
	 * Reduces p/q. Any fraction with zero denominator is infinity.
	 */
	public static Cusp of(long p, long q) {
		if (q == 0) {
			if (p == 0) {
				throw new IllegalArgumentException("0/0 is not a cusp");
			}
			return INFINITY;
		}
		long g = gcd(p, q);
		p /= g;
		q /= g;
		if (q < 0) {
			p = Math.negateExact(p);
			q = -q;
		}
		return new Cusp(p, q);
	}

	/**
	 * Reduces p/q given as big integers.
	 *
	 * @throws ArithmeticException if the reduced fraction does not fit in longs
	 */
	public static Cusp of(BigInteger p, BigInteger q) {
		if (q.signum() == 0) {
			return of(p.signum(), 0);
		}
		BigInteger g = p.gcd(q);
		if (q.signum() < 0) {
			g = g.negate();
		}
		return new Cusp(p.divide(g).longValueExact(), q.divide(g).longValueExact());
	}

	public static Cusp of(long n) {
		return new Cusp(n, 1);
	}

	public boolean isInfinity() {
		return q == 0;
	}

	public double toDouble() {
		return isInfinity() ? Double.POSITIVE_INFINITY : (double) p / q;
	}

	static long gcd(long a, long b) {
		a = Math.abs(a);
		b = Math.abs(b);
		while (b != 0) {
			long t = a % b;
			a = b;
			b = t;
		}
		return a;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Cusp)) {
			return false;
		}
		Cusp c = (Cusp) o;
		return p == c.p && q == c.q;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(p) * 31 + Long.hashCode(q);
	}

	@Override
	public String toString() {
		if (isInfinity()) {
			return "Infinity";
		}
		return q == 1 ? Long.toString(p) : p + "/" + q;
	}
}
