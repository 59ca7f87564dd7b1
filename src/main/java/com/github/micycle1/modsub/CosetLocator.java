package com.github.micycle1.modsub;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.micycle1.modsub.sl2z.SL2ZElement;
import com.github.micycle1.modsub.sl2z.SL2ZModN;

/**
 * Finds, for a matrix {@code A}, the coset j whose representative brings it
 * back into the group: {@code V_j·A ∈ G}.
 */
public interface CosetLocator {

	/** 1-based coset index j with {@code V_j·A} in the group. */
	int locate(SL2ZElement a);

	/** Generic locator: {@code j = π(A)⁻¹(1)}. */
	static CosetLocator of(CosetAction action) {
		return a -> action.act(1, a.inverse());
	}

	/**
	 * Locator for Γ0(N): the representatives' bottom rows are tabulated in
	 * P¹(Z/N), and A is looked up by the bottom row {@code (-c, a)} of
	 * {@code A⁻¹}.
	 */
	static CosetLocator forGamma0(List<SL2ZElement> reps, int level) {
		int[] units = SL2ZModN.units(level);
		Map<Long, Integer> table = new HashMap<>();
		for (int j = 0; j < reps.size(); j++) {
			SL2ZElement v = reps.get(j);
			table.put(SL2ZModN.projectiveKey(SL2ZModN.mod(v.c, level), SL2ZModN.mod(v.d, level), level, units), j + 1);
		}
		return a -> {
			Integer j = table.get(SL2ZModN.projectiveKey(SL2ZModN.mod(a.c.negate(), level), SL2ZModN.mod(a.a, level), level, units));
			if (j == null) {
				throw new PullbackException("No coset of Gamma0(" + level + ") matches " + a);
			}
			return j;
		};
	}
}
