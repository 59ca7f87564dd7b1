package com.github.micycle1.modsub;

import java.util.Optional;

import com.github.micycle1.modsub.group.CongruenceSubgroup;

/**
 * How a {@link ModularSubgroup} was constructed.
 */
public final class SubgroupOrigin {

	public enum Kind {
		PERMUTATIONS, CONGRUENCE
	}

	static final SubgroupOrigin PERMUTATIONS = new SubgroupOrigin(Kind.PERMUTATIONS, null);

	private final Kind kind;
	private final CongruenceSubgroup congruenceSubgroup;

	private SubgroupOrigin(Kind kind, CongruenceSubgroup congruenceSubgroup) {
		this.kind = kind;
		this.congruenceSubgroup = congruenceSubgroup;
	}

	static SubgroupOrigin of(CongruenceSubgroup group) {
		return new SubgroupOrigin(Kind.CONGRUENCE, group);
	}

	public Kind getKind() {
		return kind;
	}

	public Optional<CongruenceSubgroup> getCongruenceSubgroup() {
		return Optional.ofNullable(congruenceSubgroup);
	}

	@Override
	public String toString() {
		return kind == Kind.CONGRUENCE ? "congruence subgroup " + congruenceSubgroup : "permutations";
	}
}
