package com.github.micycle1.modsub;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Topological signature of a finite-index subgroup: index, number of cusps,
 * elliptic points of order 2 and 3, and genus, tied together by
 * {@code genus = 1 + (index - 6·cusps - 3·ν2 - 4·ν3)/12}.
 */
public final class Signature {

	public final int index;
	public final int cusps;
	public final int nu2;
	public final int nu3;
	public final int genus;

	private Signature(int index, int cusps, int nu2, int nu3, int genus) {
		this.index = index;
		this.cusps = cusps;
		this.nu2 = nu2;
		this.nu3 = nu3;
		this.genus = genus;
	}

	/**
	 * @throws ConsistencyException if the genus comes out negative or
	 *                              non-integral
	 */
	public static Signature of(int index, int cusps, int nu2, int nu3) {
		int excess = index - 6 * cusps - 3 * nu2 - 4 * nu3;
		if (excess % 12 != 0) {
			throw new ConsistencyException("Non-integral genus for index " + index + ", " + cusps + " cusps, nu2 = " + nu2
					+ ", nu3 = " + nu3);
		}
		int genus = 1 + excess / 12;
		if (genus < 0) {
			throw new ConsistencyException("Negative genus " + genus + " for index " + index);
		}
		return new Signature(index, cusps, nu2, nu3, genus);
	}

	/**
	 * All signatures a subgroup of the given index could have: the genus is a
	 * non-negative integer, {@code index - ν2} is even and {@code index - ν3} is
	 * divisible by 3.
	 */
	public static List<Signature> validSignatures(int index) {
		List<Signature> out = new ArrayList<>();
		for (int h = 1; h <= index; h++) {
			for (int e2 = index % 2; e2 <= index; e2 += 2) {
				for (int e3 = index % 3; e3 <= index; e3 += 3) {
					int excess = index - 6 * h - 3 * e2 - 4 * e3;
					if (excess % 12 == 0 && excess >= -12) {
						out.add(new Signature(index, h, e2, e3, 1 + excess / 12));
					}
				}
			}
		}
		return out;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Signature)) {
			return false;
		}
		Signature s = (Signature) o;
		return index == s.index && cusps == s.cusps && nu2 == s.nu2 && nu3 == s.nu3 && genus == s.genus;
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, cusps, nu2, nu3, genus);
	}

	@Override
	public String toString() {
		return "Signature[index=" + index + ", cusps=" + cusps + ", nu2=" + nu2 + ", nu3=" + nu3 + ", genus=" + genus
				+ "]";
	}
}
