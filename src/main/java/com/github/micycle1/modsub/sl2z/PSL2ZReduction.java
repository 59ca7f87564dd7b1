package com.github.micycle1.modsub.sl2z;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Reduction of a point of the upper half-plane into the standard fundamental
 * domain {@code |x| <= 1/2, x² + y² >= 1} of the full modular group, by
 * alternating nearest-integer translations with the inversion S.
 */
public final class PSL2ZReduction {

	public static final int MAX_STEPS = 10000;

	private PSL2ZReduction() {
	}

	public static final class Result {
		public final double x;
		public final double y;
		/** Matrix with {@code map(z) = x + iy}. */
		public final SL2ZElement map;

		Result(double x, double y, SL2ZElement map) {
			this.x = x;
			this.y = y;
			this.map = map;
		}
	}

	public static final class PreciseResult {
		public final BigDecimal x;
		public final BigDecimal y;
		public final SL2ZElement map;

		PreciseResult(BigDecimal x, BigDecimal y, SL2ZElement map) {
			this.x = x;
			this.y = y;
			this.map = map;
		}
	}

	public static Result reduce(double x, double y) {
		checkUpper(y > 0, y);
		SL2ZElement a = SL2ZElement.IDENTITY;
		for (int step = 0; step < MAX_STEPS; step++) {
			// exact rounding: after an inversion x can exceed the long range
			BigInteger n = NearestInteger.round(new BigDecimal(x));
			if (n.signum() != 0) {
				x -= n.doubleValue();
				a = SL2ZElement.translation(n.negate()).multiply(a);
			}
			double r = x * x + y * y;
			if (r >= 1.0) {
				return new Result(x, y, a);
			}
			x = -x / r;
			y = y / r;
			a = SL2ZElement.S.multiply(a);
		}
		throw new ArithmeticException("Reduction did not terminate within " + MAX_STEPS + " steps");
	}

	public static PreciseResult reduce(BigDecimal x, BigDecimal y, MathContext mc) {
		checkUpper(y.signum() > 0, y);
		SL2ZElement a = SL2ZElement.IDENTITY;
		for (int step = 0; step < MAX_STEPS; step++) {
			BigInteger n = NearestInteger.round(x);
			if (n.signum() != 0) {
				x = x.subtract(new BigDecimal(n), mc);
				a = SL2ZElement.translation(n.negate()).multiply(a);
			}
			BigDecimal r = x.multiply(x, mc).add(y.multiply(y, mc), mc);
			if (r.compareTo(BigDecimal.ONE) >= 0) {
				return new PreciseResult(x, y, a);
			}
			x = x.negate().divide(r, mc);
			y = y.divide(r, mc);
			a = SL2ZElement.S.multiply(a);
		}
		throw new ArithmeticException("Reduction did not terminate within " + MAX_STEPS + " steps");
	}

	private static void checkUpper(boolean ok, Object y) {
		if (!ok) {
			throw new IllegalArgumentException("Point must lie in the upper half-plane, got y = " + y);
		}
	}
}
