package com.github.micycle1.modsub.group;

import com.github.micycle1.modsub.sl2z.SL2ZElement;
import com.github.micycle1.modsub.sl2z.SL2ZModN;

/** Γ0(N): matrices with {@code c ≡ 0 mod N}. */
public final class Gamma0 extends BottomRowSubgroup {

	public Gamma0(int level) {
		super(level, SL2ZModN.units(level));
	}

	@Override
	public boolean contains(SL2ZElement m) {
		return SL2ZModN.mod(m.c, level) == 0;
	}

	@Override
	public boolean isGamma0() {
		return true;
	}

	@Override
	public String toString() {
		return "Gamma0(" + level + ")";
	}
}
