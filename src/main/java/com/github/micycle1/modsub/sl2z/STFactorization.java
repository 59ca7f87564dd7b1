package com.github.micycle1.modsub.sl2z;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * A word {@code A = sign · T^t0 · S · T^e1 · S · ... · S · T^ek} in the
 * standard generators, obtained from the nearest-integer continued fraction
 * of {@code a/c}.
 */
public final class STFactorization {

	public final int sign;
	public final BigInteger t0;
	private final BigInteger[] exponents;

	STFactorization(int sign, BigInteger t0, BigInteger[] exponents) {
		this.sign = sign;
		this.t0 = t0;
		this.exponents = exponents;
	}

	/**
	 * Factors {@code A}. The result is checked against {@code A} before it is
	 * returned.
	 *
	 * @throws FactorizationException if the reconstruction does not reproduce
	 *                                {@code ±A}
	 */
	public static STFactorization of(SL2ZElement m) {
		STFactorization f;
		if (m.c.signum() == 0) {
			// a = d = ±1
			f = m.a.signum() > 0 ? new STFactorization(1, m.b, new BigInteger[0])
					: new STFactorization(-1, m.b.negate(), new BigInteger[0]);
		} else {
			BigInteger[] cf = ContinuedFractions.ofRational(m.a, m.c);
			SL2ZElement partial = SL2ZElement.translation(cf[0]);
			for (int k = 1; k < cf.length; k++) {
				partial = partial.multiply(SL2ZElement.S).multiply(SL2ZElement.translation(cf[k]));
			}
			// partial·S maps infinity to a/c, so S⁻¹·partial⁻¹·A fixes infinity
			SL2ZElement tail = SL2ZElement.S.inverse().multiply(partial.inverse()).multiply(m);
			if (tail.c.signum() != 0 || !tail.a.abs().equals(BigInteger.ONE)) {
				throw new FactorizationException("Trailing factor of " + m + " is not a translation: " + tail);
			}
			BigInteger j = tail.a.signum() > 0 ? tail.b : tail.b.negate();
			BigInteger[] exps = Arrays.copyOf(Arrays.copyOfRange(cf, 1, cf.length), cf.length);
			exps[cf.length - 1] = j;
			f = new STFactorization(tail.a.signum() > 0 ? 1 : -1, cf[0], exps);
		}
		SL2ZElement check = f.toMatrix();
		if (!check.equals(m)) {
			throw new FactorizationException("Factorization of " + m + " reconstructs " + check);
		}
		return f;
	}

	/** Exponents {@code e1..ek}; one per occurrence of S. */
	public BigInteger[] exponents() {
		return exponents.clone();
	}

	public int length() {
		return exponents.length;
	}

	public BigInteger exponent(int k) {
		return exponents[k];
	}

	public SL2ZElement toMatrix() {
		SL2ZElement r = SL2ZElement.translation(t0);
		for (BigInteger e : exponents) {
			r = r.multiply(SL2ZElement.S).multiply(SL2ZElement.translation(e));
		}
		return sign < 0 ? r.negate() : r;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(sign < 0 ? "-" : "");
		sb.append("T^").append(t0);
		for (BigInteger e : exponents) {
			sb.append(" S T^").append(e);
		}
		return sb.toString();
	}
}
