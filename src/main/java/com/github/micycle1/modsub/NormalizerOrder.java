package com.github.micycle1.modsub;

import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.modsub.sl2z.Cusp;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * Atkin–Lehner type data of a cusp normalizer {@code N}: the least order k with
 * {@code N^k} back in the group, and the twist, the lower-right entry of that
 * power. {@code (0, 0)} means no such power was found.
 */
public final class NormalizerOrder {

	private static final Logger LOG = LoggerFactory.getLogger(NormalizerOrder.class);

	public static final NormalizerOrder UNKNOWN = new NormalizerOrder(0, 0);
	public static final NormalizerOrder TRIVIAL = new NormalizerOrder(1, 1);

	public final int order;
	public final long twist;

	public NormalizerOrder(int order, long twist) {
		this.order = order;
		this.twist = twist;
	}

	public boolean isKnown() {
		return order > 0;
	}

	/**
	 * Normalizer order of cusp {@code cuspIndex} of Γ0(level), where cusp 0 is
	 * infinity and cusp 1 is 0. Powers are only searched when the normalizer
	 * passes the Atkin–Lehner shape test for {@code Q = N·p/q}: with
	 * {@code f = lcm(a, Q)}, {@code Q | fa}, {@code Q | fd}, {@code N | fc} and
	 * {@code det(f·N0) = Q}.
	 */
	static NormalizerOrder forGamma0Cusp(CuspData cusp, int level, Predicate<SL2ZElement> group) {
		if (cusp.index == 0) {
			return TRIVIAL;
		}
		SL2ZElement n0 = cusp.normalizer;
		try {
			long a = n0.a.longValueExact(), b = n0.b.longValueExact();
			long c = n0.c.longValueExact(), d = n0.d.longValueExact();
			if (cusp.index == 1) {
				if (a == 0 && d == 0 && b * c == -1) {
					return new NormalizerOrder(2, 1);
				}
				return unknown("Normalizer {} of the cusp {} is not the Fricke involution", n0, cusp.value);
			}
			long w = cusp.width;
			long aa = Math.multiplyExact(a, w);
			long cc = Math.multiplyExact(c, w);
			if (cc == level && aa != 0 && level % aa == 0
					&& Math.subtractExact(Math.multiplyExact(aa, d), Math.multiplyExact(b, cc)) == aa) {
				return new NormalizerOrder(2, d);
			}
			// an involution of Atkin-Lehner type needs Q = N·p/q with Q || N
			Cusp v = cusp.value;
			long lp = Math.multiplyExact((long) level, v.p);
			if (v.q == 0 || lp % v.q != 0) {
				return unknown("Normalizer {} of cusp {}: N·p/q is not an integer", n0, v);
			}
			long q = Math.abs(lp / v.q);
			if (q == 0 || level % q != 0) {
				return unknown("Normalizer {} of cusp {}: Q = N·p/q does not divide the level", n0, v);
			}
			if (gcd(q, level / q) != 1) {
				return unknown("Normalizer {} of cusp {}: Q and N/Q are not coprime", n0, v);
			}
			long f = a == 0 ? 0 : Math.multiplyExact(Math.abs(a) / gcd(a, q), q);
			long fa = Math.multiplyExact(f, a), fb = Math.multiplyExact(f, b);
			long fc = Math.multiplyExact(f, c), fd = Math.multiplyExact(f, d);
			if (f == 0 || fa % q != 0 || fd % q != 0 || fc % level != 0
					|| Math.subtractExact(Math.multiplyExact(fa, fd), Math.multiplyExact(fb, fc)) != q) {
				return unknown("Normalizer {} of cusp {} is not of Atkin-Lehner shape", n0, v);
			}
			SL2ZElement power = n0;
			for (int k = 2; k < level; k++) {
				power = power.multiply(n0);
				if (group.test(power)) {
					return new NormalizerOrder(k, power.d.longValueExact());
				}
			}
		} catch (ArithmeticException e) {
			LOG.warn("Overflow while computing the order of normalizer {}: {}", n0, e.getMessage());
			return UNKNOWN;
		}
		return unknown("Normalizer {} of cusp {} has no power in the group below the level", n0, cusp.value);
	}

	private static NormalizerOrder unknown(String message, SL2ZElement normalizer, Cusp cusp) {
		LOG.warn(message, normalizer, cusp);
		return UNKNOWN;
	}

	private static long gcd(long x, long y) {
		while (y != 0) {
			long t = x % y;
			x = y;
			y = t;
		}
		return Math.abs(x);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof NormalizerOrder)) {
			return false;
		}
		NormalizerOrder n = (NormalizerOrder) o;
		return order == n.order && twist == n.twist;
	}

	@Override
	public int hashCode() {
		return 31 * order + Long.hashCode(twist);
	}

	@Override
	public String toString() {
		return "(" + order + ", " + twist + ")";
	}
}
