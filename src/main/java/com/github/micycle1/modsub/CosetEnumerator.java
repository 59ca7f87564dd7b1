package com.github.micycle1.modsub;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.modsub.group.CongruenceSubgroup;
import com.github.micycle1.modsub.perm.Permutation;
import com.github.micycle1.modsub.sl2z.SL2ZElement;
import com.github.micycle1.modsub.sl2z.SL2ZModN;

/**
 * <p>
 * Produces right coset representatives {@code V_1 = I, V_2, ..., V_n} of a
 * finite-index subgroup, labelled so that the coset action sends the base coset
 * 1 to {@code j} under {@code V_j}.
 * </p>
 *
 * <p>
 * Two strategies:
 * </p>
 * <ul>
 * <li>{@link #fromPermutations}: walks the cycles of {@code permT} by powers of
 * T and joins cycles through {@code permS}.</li>
 * <li>{@link #fromCongruenceSubgroup}: grows representatives from I, S and the
 * translates {@code S·T^j} by right multiplication with S, T and T⁻¹,
 * admitting only matrices inequivalent to those already present.</li>
 * </ul>
 */
public final class CosetEnumerator {

	private static final Logger LOG = LoggerFactory.getLogger(CosetEnumerator.class);

	private CosetEnumerator() {
	}

	/**
	 * Representatives for the subgroup whose coset action is given by
	 * {@code (permS, permR)}; element {@code j-1} of the result is {@code V_j}.
	 *
	 * @throws CosetEnumerationException if some T-cycle cannot be reached, or the
	 *                                   result does not label the cosets
	 *                                   correctly
	 */
	public static List<SL2ZElement> fromPermutations(Permutation permS, Permutation permR) {
		Permutation permT = permS.multiply(permR);
		int n = permT.size();
		List<int[]> cycles = permT.cycles();
		SL2ZElement[] reps = new SL2ZElement[n + 1];
		List<Integer> placed = new ArrayList<>(n);
		boolean[] cyclePlaced = new boolean[cycles.size()];

		// the cycle of 1 comes first
		reps[1] = SL2ZElement.IDENTITY;
		placed.add(1);
		fillCycle(cycles.get(0), 1, reps, placed);
		cyclePlaced[0] = true;
		int remaining = cycles.size() - 1;

		while (remaining > 0) {
			boolean progress = false;
			for (int k = 0; k < cycles.size(); k++) {
				if (cyclePlaced[k]) {
					continue;
				}
				int[] cycle = cycles.get(k);
				for (int idx = 0; idx < placed.size(); idx++) {
					int i = placed.get(idx);
					int target = permS.apply(i);
					if (contains(cycle, target)) {
						reps[target] = reps[i].multiply(SL2ZElement.S);
						placed.add(target);
						fillCycle(cycle, target, reps, placed);
						cyclePlaced[k] = true;
						remaining--;
						progress = true;
						break;
					}
				}
			}
			if (!progress) {
				throw new CosetEnumerationException("No S-edge reaches the remaining T-cycles; permutations are not transitive",
						collect(reps));
			}
		}
		List<SL2ZElement> result = collect(reps);
		if (result.size() != n) {
			throw new CosetEnumerationException("Expected " + n + " representatives", result);
		}
		CosetAction action = new CosetAction(permS, permT);
		for (int j = 1; j <= n; j++) {
			int image = action.act(1, result.get(j - 1));
			if (image != j) {
				throw new CosetEnumerationException("Representative " + result.get(j - 1) + " sends 1 to " + image
						+ " instead of " + j, result);
			}
		}
		LOG.debug("Enumerated {} coset representatives over {} T-cycles", n, cycles.size());
		return result;
	}

	// Representatives along a cycle from an already placed point, by T^k with k
	// taken in the symmetric range around 0.
	private static void fillCycle(int[] cycle, int start, SL2ZElement[] reps, List<Integer> placed) {
		int r = cycle.length;
		int startPos = indexOf(cycle, start);
		for (int m = 1; m < r; m++) {
			int e = cycle[(startPos + m) % r];
			int k = m > r / 2 ? m - r : m;
			reps[e] = reps[start].multiply(SL2ZElement.translation(k));
			placed.add(e);
		}
	}

	/**
	 * Representatives for an externally supplied congruence subgroup.
	 *
	 * @throws CosetEnumerationException if fewer than {@code index()}
	 *                                   inequivalent representatives are found
	 */
	public static List<SL2ZElement> fromCongruenceSubgroup(CongruenceSubgroup group) {
		int target = group.index();
		int level = group.level();
		boolean gamma0 = group.isGamma0();
		List<SL2ZElement> reps = new ArrayList<>(target);
		reps.add(SL2ZElement.IDENTITY);
		if (reps.size() < target && !group.contains(SL2ZElement.S)) {
			reps.add(SL2ZElement.S);
		}

		// translates S·T^j = [[0,-1],[1,j]]
		List<Long> shifts = new ArrayList<>();
		if (gamma0) {
			long lo = level % 2 == 0 ? -level / 2 + 1 : -(level - 1) / 2;
			long hi = level % 2 == 0 ? level / 2 : (level - 1) / 2;
			for (long j = lo; j <= hi; j++) {
				if (j != 0) {
					shifts.add(j);
				}
			}
		} else {
			for (long j = 1; j <= level / 2 + 1; j++) {
				shifts.add(j);
				shifts.add(-j);
			}
		}
		for (long j : shifts) {
			if (reps.size() >= target) {
				break;
			}
			admit(new SL2ZElement(0, -1, 1, j), reps, group, gamma0);
		}

		// saturate; the list doubles as the BFS queue
		SL2ZElement[] moves = { SL2ZElement.S, SL2ZElement.T, SL2ZElement.T_INV };
		for (int i = 0; i < reps.size() && reps.size() < target; i++) {
			for (SL2ZElement x : moves) {
				if (reps.size() >= target) {
					break;
				}
				admit(reps.get(i).multiply(x), reps, group, gamma0);
			}
		}
		if (reps.size() != target) {
			throw new CosetEnumerationException("Expected " + target + " representatives for " + group, reps);
		}
		LOG.debug("Enumerated {} coset representatives of {} (level {})", target, group, level);
		return reps;
	}

	private static void admit(SL2ZElement candidate, List<SL2ZElement> reps, CongruenceSubgroup group, boolean gamma0) {
		for (SL2ZElement w : reps) {
			if (equivalent(candidate, w, group, gamma0)) {
				return;
			}
		}
		reps.add(candidate);
	}

	/** Whether {@code A·W⁻¹} lies in the group. */
	static boolean equivalent(SL2ZElement a, SL2ZElement w, CongruenceSubgroup group, boolean gamma0) {
		if (gamma0) {
			// lower-left entry of A·W⁻¹
			BigInteger c = a.c.multiply(w.d).subtract(a.d.multiply(w.c));
			return SL2ZModN.mod(c, group.level()) == 0;
		}
		return group.contains(a.multiply(w.inverse()));
	}

	/**
	 * The coset action of S and of {@code R = S·T} on the given
	 * representatives: {@code permS(i) = j} exactly when {@code V_i·S·V_j⁻¹}
	 * lies in the group.
	 *
	 * @return {@code {permS, permR}}
	 * @throws ConsistencyException if some product lies in no coset
	 */
	public static Permutation[] actionOn(List<SL2ZElement> reps, Predicate<SL2ZElement> group) {
		int n = reps.size();
		SL2ZElement[] inverses = new SL2ZElement[n];
		for (int j = 0; j < n; j++) {
			inverses[j] = reps.get(j).inverse();
		}
		int[][] images = new int[2][n];
		SL2ZElement[] gens = { SL2ZElement.S, SL2ZElement.R };
		for (int g = 0; g < 2; g++) {
			for (int i = 0; i < n; i++) {
				SL2ZElement vx = reps.get(i).multiply(gens[g]);
				int found = -1;
				for (int j = 0; j < n && found < 0; j++) {
					if (group.test(vx.multiply(inverses[j]))) {
						found = j + 1;
					}
				}
				if (found < 0) {
					throw new ConsistencyException("No representative is equivalent to " + vx);
				}
				images[g][i] = found;
			}
		}
		return new Permutation[] { new Permutation(images[0]), new Permutation(images[1]) };
	}

	/**
	 * Checks that permutations derived from representatives describe the same
	 * action as the generating permutations {@code (L, U)} of the group: the
	 * cycle types of S, T and R must agree.
	 */
	static void checkAgainst(Permutation permS, Permutation permR, Permutation[] generating) {
		Permutation l = generating[0];
		Permutation u = generating[1];
		Permutation s = l.multiply(u.inverse()).multiply(l);
		Permutation r = s.multiply(l);
		Permutation permT = permS.multiply(permR);
		if (!Arrays.equals(s.cycleType(), permS.cycleType()) || !Arrays.equals(l.cycleType(), permT.cycleType())
				|| !Arrays.equals(r.cycleType(), permR.cycleType())) {
			throw new ConsistencyException("Coset action (" + permS + ", " + permR
					+ ") does not match the generating permutations (" + l + ", " + u + ")");
		}
	}

	private static boolean contains(int[] cycle, int x) {
		return indexOf(cycle, x) >= 0;
	}

	private static int indexOf(int[] cycle, int x) {
		for (int k = 0; k < cycle.length; k++) {
			if (cycle[k] == x) {
				return k;
			}
		}
		return -1;
	}

	private static List<SL2ZElement> collect(SL2ZElement[] reps) {
		List<SL2ZElement> out = new ArrayList<>();
		for (int j = 1; j < reps.length; j++) {
			if (reps[j] != null) {
				out.add(reps[j]);
			}
		}
		return out;
	}
}
