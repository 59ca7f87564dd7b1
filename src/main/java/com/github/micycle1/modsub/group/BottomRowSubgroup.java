package com.github.micycle1.modsub.group;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.micycle1.modsub.perm.Permutation;
import com.github.micycle1.modsub.sl2z.SL2ZElement;
import com.github.micycle1.modsub.sl2z.SL2ZModN;

/**
 * Base for congruence subgroups whose right cosets are classified by the bottom
 * row {@code (c, d)} of a representative, reduced mod N and taken up to a group
 * of scalars. The coset of the group itself is the class of {@code (0, 1)}.
 */
public abstract class BottomRowSubgroup implements CongruenceSubgroup {

	protected final int level;
	private final int[] scalars;
	private final List<long[]> rows = new ArrayList<>();
	private final Map<Long, Integer> labels = new HashMap<>();
	private final Permutation permT;
	private final Permutation permU;

	protected BottomRowSubgroup(int level, int[] scalars) {
		if (level < 1) {
			throw new IllegalArgumentException("Level must be positive: " + level);
		}
		this.level = level;
		this.scalars = scalars.clone();
		label(0, 1);
		// orbit of (0,1) under T: (c,d) -> (c,c+d) and U: (c,d) -> (c+d,d)
		List<int[]> images = new ArrayList<>();
		for (int i = 0; i < rows.size(); i++) {
			long c = rows.get(i)[0], d = rows.get(i)[1];
			int t = label(c, c + d);
			int u = label(c + d, d);
			images.add(new int[] { t, u });
		}
		int n = rows.size();
		int[] t = new int[n];
		int[] u = new int[n];
		for (int i = 0; i < n; i++) {
			t[i] = images.get(i)[0];
			u[i] = images.get(i)[1];
		}
		this.permT = new Permutation(t);
		this.permU = new Permutation(u);
	}

	private int label(long c, long d) {
		long key = key(c, d);
		Integer l = labels.get(key);
		if (l == null) {
			rows.add(new long[] { SL2ZModN.mod(c, level), SL2ZModN.mod(d, level) });
			l = rows.size();
			labels.put(key, l);
		}
		return l;
	}

	/** Canonical key of the coset whose representatives have bottom row {@code (c, d)}. */
	public long key(long c, long d) {
		return SL2ZModN.projectiveKey(c, d, level, scalars);
	}

	/** 1-based coset label of the coset {@code G·m}. */
	public int cosetLabel(SL2ZElement m) {
		Integer l = labels.get(key(SL2ZModN.mod(m.c, level), SL2ZModN.mod(m.d, level)));
		if (l == null) {
			throw new IllegalArgumentException("Bottom row of " + m + " is not primitive mod " + level);
		}
		return l;
	}

	@Override
	public int index() {
		return rows.size();
	}

	@Override
	public int level() {
		return level;
	}

	@Override
	public Permutation[] generatingPermutations() {
		return new Permutation[] { permT, permU };
	}
}
