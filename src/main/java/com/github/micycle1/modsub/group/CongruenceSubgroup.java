package com.github.micycle1.modsub.group;

import com.github.micycle1.modsub.perm.Permutation;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * A congruence subgroup supplied from outside, described by its level, a
 * membership predicate and its right action on cosets.
 */
public interface CongruenceSubgroup {

	/** Index in PSL(2,Z). */
	int index();

	int level();

	/** Membership of {@code m}; must agree for {@code m} and {@code -m}. */
	boolean contains(SL2ZElement m);

	/**
	 * The right action on cosets of {@code T = [[1,1],[0,1]]} and of
	 * {@code [[1,0],[1,1]]}, in that order, with the group itself labelled 1.
	 */
	Permutation[] generatingPermutations();

	/** Whether the group is Γ0 of its level. */
	default boolean isGamma0() {
		return false;
	}
}
