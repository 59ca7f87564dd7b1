package com.github.micycle1.modsub.sl2z;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Arithmetic in SL(2, Z/N) and on the projective line P¹(Z/N).
 */
public final class SL2ZModN {

	/** Largest subgroup closure enumerated before giving up. */
	public static final long MAX_CLOSURE_SIZE = 5_000_000L;

	private SL2ZModN() {
	}

	public static List<Integer> primeFactors(long n) {
		List<Integer> ps = new ArrayList<>();
		for (int p = 2; (long) p * p <= n; p++) {
			if (n % p == 0) {
				ps.add(p);
				while (n % p == 0) {
					n /= p;
				}
			}
		}
		if (n > 1) {
			ps.add((int) n);
		}
		return ps;
	}

	/** {@code |SL(2, Z/N)| = N³ ∏ (1 - 1/p²)}. */
	public static long sl2Order(int n) {
		long order = (long) n * n * n;
		for (int p : primeFactors(n)) {
			order = order / ((long) p * p) * ((long) p * p - 1);
		}
		return order;
	}

	/** Index of Γ0(N) in SL(2,Z), {@code N ∏ (1 + 1/p)}. */
	public static long gamma0Index(int n) {
		long idx = n;
		for (int p : primeFactors(n)) {
			idx = idx / p * (p + 1);
		}
		return idx;
	}

	public static int[] units(int n) {
		List<Integer> us = new ArrayList<>();
		for (int u = 1; u <= Math.max(1, n - 1); u++) {
			if (Cusp.gcd(u, n) == 1) {
				us.add(u);
			}
		}
		return us.stream().mapToInt(Integer::intValue).toArray();
	}

	public static long mod(long x, long n) {
		return Math.floorMod(x, n);
	}

	public static long mod(BigInteger x, long n) {
		return x.mod(BigInteger.valueOf(n)).longValue();
	}

	/**
	 * Canonical key of the class of {@code (c : d)} in P¹(Z/N) modulo the given
	 * scalars: the least {@code (u·c mod N)·N + (u·d mod N)} over the scalars u.
	 */
	public static long projectiveKey(long c, long d, int n, int[] scalars) {
		long cm = mod(c, n), dm = mod(d, n);
		long best = Long.MAX_VALUE;
		for (int u : scalars) {
			long key = (u * cm % n) * n + (u * dm % n);
			if (key < best) {
				best = key;
			}
		}
		return best;
	}

	/** Packs a matrix reduced mod N into one long. */
	static long pack(long a, long b, long c, long d, int n) {
		return ((mod(a, n) * n + mod(b, n)) * n + mod(c, n)) * n + mod(d, n);
	}

	/**
	 * Order of the subgroup of SL(2, Z/N) generated by the reductions of the
	 * given matrices.
	 *
	 * @return the order, or -1 if it exceeds {@code limit}
	 */
	public static long closureOrder(Collection<SL2ZElement> generators, int n, long limit) {
		if (n == 1) {
			return 1;
		}
		List<long[]> gens = new ArrayList<>();
		for (SL2ZElement g : generators) {
			gens.add(new long[] { mod(g.a, n), mod(g.b, n), mod(g.c, n), mod(g.d, n) });
		}
		Set<Long> seen = new HashSet<>();
		Queue<long[]> queue = new ArrayDeque<>();
		long[] id = { 1, 0, 0, 1 };
		seen.add(pack(1, 0, 0, 1, n));
		queue.add(id);
		long cap = Math.min(limit, MAX_CLOSURE_SIZE);
		while (!queue.isEmpty()) {
			long[] x = queue.poll();
			for (long[] g : gens) {
				long a = (x[0] * g[0] + x[1] * g[2]) % n;
				long b = (x[0] * g[1] + x[1] * g[3]) % n;
				long c = (x[2] * g[0] + x[3] * g[2]) % n;
				long d = (x[2] * g[1] + x[3] * g[3]) % n;
				if (seen.add(pack(a, b, c, d, n))) {
					if (seen.size() > cap) {
						return -1;
					}
					queue.add(new long[] { a, b, c, d });
				}
			}
		}
		return seen.size();
	}
}
