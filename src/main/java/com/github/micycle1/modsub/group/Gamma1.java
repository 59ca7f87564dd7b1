package com.github.micycle1.modsub.group;

import com.github.micycle1.modsub.sl2z.SL2ZElement;
import com.github.micycle1.modsub.sl2z.SL2ZModN;

/**
 * Image of Γ1(N) in PSL(2,Z): matrices with {@code c ≡ 0} and
 * {@code a ≡ d ≡ ±1 mod N}.
 */
public final class Gamma1 extends BottomRowSubgroup {

	public Gamma1(int level) {
		super(level, level <= 2 ? new int[] { 1 } : new int[] { 1, level - 1 });
	}

	@Override
	public boolean contains(SL2ZElement m) {
		if (SL2ZModN.mod(m.c, level) != 0) {
			return false;
		}
		long a = SL2ZModN.mod(m.a, level);
		return a == SL2ZModN.mod(1, level) || a == SL2ZModN.mod(-1, level);
	}

	@Override
	public String toString() {
		return "Gamma1(" + level + ")";
	}
}
