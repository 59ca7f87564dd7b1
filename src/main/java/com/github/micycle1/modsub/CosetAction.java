package com.github.micycle1.modsub;

import java.math.BigInteger;
import java.util.List;

import com.github.micycle1.modsub.perm.Permutation;
import com.github.micycle1.modsub.sl2z.STFactorization;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * The right action {@code i ↦ i·A} of SL(2,Z) on the cosets {1..n} of a
 * subgroup, given by the images of S and T. A matrix acts through its S/T
 * word, and powers of T are read off the cycles of {@code permT}.
 */
public final class CosetAction {

	private final Permutation permS;
	private final Permutation permT;
	private final int[][] cycles;
	private final int[] cycleOf;
	private final int[] position;

	public CosetAction(Permutation permS, Permutation permT) {
		this.permS = permS;
		this.permT = permT;
		int n = permT.size();
		List<int[]> cs = permT.cycles();
		cycles = cs.toArray(new int[0][]);
		cycleOf = new int[n + 1];
		position = new int[n + 1];
		for (int k = 0; k < cycles.length; k++) {
			for (int m = 0; m < cycles[k].length; m++) {
				cycleOf[cycles[k][m]] = k;
				position[cycles[k][m]] = m;
			}
		}
	}

	public int size() {
		return permT.size();
	}

	/** {@code i·T^k}. */
	public int translate(int i, long k) {
		int[] cycle = cycles[cycleOf[i]];
		return cycle[(int) Math.floorMod(position[i] + k, (long) cycle.length)];
	}

	/** {@code i·T^k} for exponents of any size. */
	public int translate(int i, BigInteger k) {
		int[] cycle = cycles[cycleOf[i]];
		int shift = k.mod(BigInteger.valueOf(cycle.length)).intValue();
		return cycle[(position[i] + shift) % cycle.length];
	}

	/** {@code i·A}. */
	public int act(int i, SL2ZElement m) {
		return act(i, STFactorization.of(m));
	}

	public int act(int i, STFactorization word) {
		int j = translate(i, word.t0);
		for (int k = 0; k < word.length(); k++) {
			j = translate(permS.apply(j), word.exponent(k));
		}
		return j;
	}

	/** {@code π(A)}. */
	public Permutation permutation(SL2ZElement m) {
		STFactorization word = STFactorization.of(m);
		int n = size();
		int[] img = new int[n];
		for (int i = 1; i <= n; i++) {
			img[i - 1] = act(i, word);
		}
		return new Permutation(img);
	}

	/** Whether {@code A} fixes the coset of the group itself. */
	public boolean fixesBase(SL2ZElement m) {
		return act(1, m) == 1;
	}

	public int cycleCount() {
		return cycles.length;
	}

	/** Index of the permT-cycle containing {@code i}. */
	public int cycleIndex(int i) {
		return cycleOf[i];
	}

	public int cycleLength(int i) {
		return cycles[cycleOf[i]].length;
	}

	/**
	 * The exponent {@code 0 <= k < r} with {@code from·T^k = to}.
	 *
	 * @throws IllegalArgumentException if the points lie in different cycles
	 */
	public int translationExponent(int from, int to) {
		if (cycleOf[from] != cycleOf[to]) {
			throw new IllegalArgumentException(from + " and " + to + " lie in different T-cycles");
		}
		int r = cycles[cycleOf[from]].length;
		return Math.floorMod(position[to] - position[from], r);
	}
}
