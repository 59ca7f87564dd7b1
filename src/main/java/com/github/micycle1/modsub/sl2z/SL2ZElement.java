package com.github.micycle1.modsub.sl2z;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;
import java.util.function.Predicate;

import org.ejml.data.Complex_F64;
import org.ejml.ops.ComplexMath_F64;

/**
 * <p>
 * Immutable element {@code [[a, b], [c, d]]} of SL(2,Z), acting on the upper
 * half-plane and on the projective rational line by {@code z ↦ (az+b)/(cz+d)}.
 * </p>
 *
 * <p>
 * Entries are arbitrary-precision integers: matrices produced by reducing
 * points close to the real line grow without bound.
 * </p>
 */
public final class SL2ZElement {

	public static final SL2ZElement IDENTITY = new SL2ZElement(1, 0, 0, 1);
	public static final SL2ZElement MINUS_IDENTITY = new SL2ZElement(-1, 0, 0, -1);
	/** The inversion {@code z ↦ -1/z}. */
	public static final SL2ZElement S = new SL2ZElement(0, -1, 1, 0);
	/** The translation {@code z ↦ z+1}. */
	public static final SL2ZElement T = new SL2ZElement(1, 1, 0, 1);
	public static final SL2ZElement T_INV = new SL2ZElement(1, -1, 0, 1);
	/** {@code S·T}, of order 3 in PSL(2,Z). */
	public static final SL2ZElement R = new SL2ZElement(0, -1, 1, 1);

	public final BigInteger a;
	public final BigInteger b;
	public final BigInteger c;
	public final BigInteger d;

	/**
	 * @throws IllegalArgumentException if the determinant is not 1
	 */
	public SL2ZElement(BigInteger a, BigInteger b, BigInteger c, BigInteger d) {
		if (!a.multiply(d).subtract(b.multiply(c)).equals(BigInteger.ONE)) {
			throw new IllegalArgumentException("Determinant of [[" + a + ", " + b + "], [" + c + ", " + d + "]] is not 1");
		}
		this.a = a;
		this.b = b;
		this.c = c;
		this.d = d;
	}

	public SL2ZElement(long a, long b, long c, long d) {
		this(BigInteger.valueOf(a), BigInteger.valueOf(b), BigInteger.valueOf(c), BigInteger.valueOf(d));
	}

	/** {@code T^n}. */
	public static SL2ZElement translation(long n) {
		return new SL2ZElement(1, n, 0, 1);
	}

	public static SL2ZElement translation(BigInteger n) {
		return new SL2ZElement(BigInteger.ONE, n, BigInteger.ZERO, BigInteger.ONE);
	}

	/**
	 * A matrix sending infinity to the given cusp; the identity for infinity
	 * itself.
	 */
	public static SL2ZElement lift(Cusp cusp) {
		if (cusp.isInfinity()) {
			return IDENTITY;
		}
		// p*s + q*t = 1  =>  [[p, -t], [q, s]]
		long[] st = extendedGcd(cusp.p, cusp.q);
		return new SL2ZElement(cusp.p, -st[1], cusp.q, st[0]);
	}

	// returns {s, t} with a*s + b*t = gcd(a, b) = 1 for coprime input
	static long[] extendedGcd(long a, long b) {
		long oldR = a, r = b;
		long oldS = 1, s = 0;
		long oldT = 0, t = 1;
		while (r != 0) {
			long quot = Math.floorDiv(oldR, r);
			long tmp = r;
			r = oldR - quot * r;
			oldR = tmp;
			tmp = s;
			s = oldS - quot * s;
			oldS = tmp;
			tmp = t;
			t = oldT - quot * t;
			oldT = tmp;
		}
		if (oldR < 0) {
			oldS = -oldS;
			oldT = -oldT;
		}
		return new long[] { oldS, oldT };
	}

	public SL2ZElement multiply(SL2ZElement o) {
		return new SL2ZElement(
				a.multiply(o.a).add(b.multiply(o.c)),
				a.multiply(o.b).add(b.multiply(o.d)),
				c.multiply(o.a).add(d.multiply(o.c)),
				c.multiply(o.b).add(d.multiply(o.d)));
	}

	public SL2ZElement inverse() {
		return new SL2ZElement(d, b.negate(), c.negate(), a);
	}

	public SL2ZElement negate() {
		return new SL2ZElement(a.negate(), b.negate(), c.negate(), d.negate());
	}

	public SL2ZElement pow(long k) {
		SL2ZElement base = k < 0 ? inverse() : this;
		long e = Math.abs(k);
		SL2ZElement result = IDENTITY;
		while (e > 0) {
			if ((e & 1) == 1) {
				result = result.multiply(base);
			}
			e >>= 1;
			if (e > 0) {
				base = base.multiply(base);
			}
		}
		return result;
	}

	/** {@code A·this·A⁻¹}. */
	public SL2ZElement conjugateBy(SL2ZElement conj) {
		return conj.multiply(this).multiply(conj.inverse());
	}

	public BigInteger trace() {
		return a.add(d);
	}

	public boolean isIdentityUpToSign() {
		return b.signum() == 0 && c.signum() == 0 && a.equals(d);
	}

	public boolean equalsUpToSign(SL2ZElement o) {
		return equals(o) || equals(o.negate());
	}

	/** The representative of {@code ±this} with {@code c > 0}, or {@code c = 0} and {@code d > 0}. */
	public SL2ZElement normalizedSign() {
		if (c.signum() < 0 || (c.signum() == 0 && d.signum() < 0)) {
			return negate();
		}
		return this;
	}

	public boolean isIn(Predicate<SL2ZElement> group) {
		return group.test(this);
	}

	/** Largest absolute value among the entries. */
	public BigInteger maxAbsEntry() {
		return a.abs().max(b.abs()).max(c.abs().max(d.abs()));
	}

	/** Image of a cusp under the Möbius action. */
	public Cusp apply(Cusp z) {
		if (z.isInfinity()) {
			return Cusp.of(a, c);
		}
		BigInteger p = BigInteger.valueOf(z.p), q = BigInteger.valueOf(z.q);
		return Cusp.of(a.multiply(p).add(b.multiply(q)), c.multiply(p).add(d.multiply(q)));
	}

	/** Image of a point of the upper half-plane. */
	public Complex_F64 apply(Complex_F64 z) {
		double da = a.doubleValue(), db = b.doubleValue(), dc = c.doubleValue(), dd = d.doubleValue();
		Complex_F64 num = new Complex_F64(da * z.real + db, da * z.imaginary);
		Complex_F64 den = new Complex_F64(dc * z.real + dd, dc * z.imaginary);
		Complex_F64 out = new Complex_F64();
		ComplexMath_F64.divide(num, den, out);
		return out;
	}

	/**
	 * Image of {@code x + iy} in arbitrary precision.
	 *
	 * @return {@code {x', y'}}
	 */
	public BigDecimal[] apply(BigDecimal x, BigDecimal y, MathContext mc) {
		BigDecimal ba = new BigDecimal(a), bb = new BigDecimal(b);
		BigDecimal bc = new BigDecimal(c), bd = new BigDecimal(d);
		BigDecimal cxd = bc.multiply(x, mc).add(bd, mc);
		BigDecimal cy = bc.multiply(y, mc);
		BigDecimal den = cxd.multiply(cxd, mc).add(cy.multiply(cy, mc), mc);
		BigDecimal axb = ba.multiply(x, mc).add(bb, mc);
		BigDecimal re = axb.multiply(cxd, mc).add(ba.multiply(bc, mc).multiply(y.multiply(y, mc), mc), mc);
		return new BigDecimal[] { re.divide(den, mc), y.divide(den, mc) };
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SL2ZElement)) {
			return false;
		}
		SL2ZElement m = (SL2ZElement) o;
		return a.equals(m.a) && b.equals(m.b) && c.equals(m.c) && d.equals(m.d);
	}

	@Override
	public int hashCode() {
		return Objects.hash(a, b, c, d);
	}

	@Override
	public String toString() {
		return "[[" + a + ", " + b + "], [" + c + ", " + d + "]]";
	}
}
