package com.github.micycle1.modsub;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import org.ejml.data.Complex_F64;

import com.github.micycle1.modsub.sl2z.PSL2ZReduction;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * <p>
 * Maps points of the upper half-plane into the fundamental domain
 * {@code ∪ V_j(F)} of a subgroup, F being the standard domain of the modular
 * group.
 * </p>
 *
 * <p>
 * A point is first reduced into F by a matrix A; the coset locator then picks
 * the j with {@code B = V_j·A} in the group, and {@code B(z) = V_j(A(z))}. The
 * returned matrix is sign-normalized ({@code c > 0}, or {@code c = 0} and
 * {@code d > 0}).
 * </p>
 */
public final class Pullback {

	/** Requests at or below this many bits use double arithmetic. */
	public static final int DOUBLE_PRECISION_BITS = 53;
	public static final int DEFAULT_PRECISION_BITS = 201;

	private static final double LOG10_2 = Math.log10(2.0);

	private final List<SL2ZElement> reps;
	private final CosetLocator locator;
	private final Predicate<SL2ZElement> group;

	Pullback(List<SL2ZElement> reps, CosetLocator locator, Predicate<SL2ZElement> group) {
		this.reps = reps;
		this.locator = locator;
		this.group = group;
	}

	public static final class Result {
		public final double x;
		public final double y;
		/** Group element sending the input point to {@code x + iy}. */
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

	public Result pullback(double x, double y) {
		PSL2ZReduction.Result reduced = PSL2ZReduction.reduce(x, y);
		int j = locator.locate(reduced.map);
		SL2ZElement vj = reps.get(j - 1);
		SL2ZElement b = groupElement(vj, reduced.map);
		Complex_F64 w = vj.apply(new Complex_F64(reduced.x, reduced.y));
		return new Result(w.real, w.imaginary, b);
	}

	/**
	 * Pullback in the requested binary precision. Requests of at most
	 * {@link #DOUBLE_PRECISION_BITS} bits are served in double arithmetic.
	 */
	public PreciseResult pullback(BigDecimal x, BigDecimal y, int precisionBits) {
		Objects.requireNonNull(x, "x");
		Objects.requireNonNull(y, "y");
		if (precisionBits <= DOUBLE_PRECISION_BITS) {
			Result r = pullback(x.doubleValue(), y.doubleValue());
			return new PreciseResult(new BigDecimal(r.x), new BigDecimal(r.y), r.map);
		}
		int digits = (int) Math.ceil(precisionBits * LOG10_2);
		MathContext working = new MathContext(digits + 10, RoundingMode.HALF_EVEN);
		PSL2ZReduction.PreciseResult reduced = PSL2ZReduction.reduce(x, y, working);
		int j = locator.locate(reduced.map);
		SL2ZElement b = groupElement(reps.get(j - 1), reduced.map);

		// apply B to the input point again, with room for the size of its entries
		int margin = 2 * b.maxAbsEntry().toString().length();
		MathContext exact = new MathContext(digits + 10 + margin, RoundingMode.HALF_EVEN);
		BigDecimal[] w = b.apply(x, y, exact);
		MathContext out = new MathContext(digits, RoundingMode.HALF_EVEN);
		return new PreciseResult(w[0].round(out), w[1].round(out), b);
	}

	private SL2ZElement groupElement(SL2ZElement vj, SL2ZElement a) {
		SL2ZElement b = vj.multiply(a).normalizedSign();
		if (!group.test(b)) {
			throw new PullbackException("Reduction matrix " + a + " composed with " + vj + " is not in the group");
		}
		return b;
	}
}
