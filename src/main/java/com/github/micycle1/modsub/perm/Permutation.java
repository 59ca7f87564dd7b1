package com.github.micycle1.modsub.perm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;

/**
 * <p>
 * Immutable permutation of the points {1..n}.
 * </p>
 *
 * <p>
 * Products are read left to right: {@code p.multiply(q)} first applies
 * {@code p} and then {@code q}, so {@code (p·q)(i) = q(p(i))}. With this
 * convention the action of the modular group on right cosets, {@code i ↦ i·A},
 * is a homomorphism {@code π(AB) = π(A)·π(B)}.
 * </p>
 */
public final class Permutation {

	// images[i - 1] is the image of i
	private final int[] images;

	/**
	 * @param images images of 1..n, in order
	 * @throws PermutationFormatException if the data is not a bijection of {1..n}
	 */
	public Permutation(int... images) {
		Objects.requireNonNull(images, "images");
		this.images = images.clone();
		validate(this.images);
	}

	private Permutation(int[] images, boolean trusted) {
		this.images = images;
	}

	public static Permutation identity(int n) {
		if (n < 1) {
			throw new PermutationFormatException("Permutation size must be positive: " + n);
		}
		int[] img = new int[n];
		for (int i = 0; i < n; i++) {
			img[i] = i + 1;
		}
		return new Permutation(img, true);
	}

	/**
	 * Parses cycle notation such as {@code (1,2)(3,4)} or {@code (1 3 2)(4 5 6)}.
	 * Points not mentioned are fixed; {@code ()} or an empty string is the
	 * identity.
	 */
	public static Permutation parseCycles(String cycles, int n) {
		Objects.requireNonNull(cycles, "cycles");
		int[] img = identity(n).images.clone();
		boolean[] seen = new boolean[n + 1];
		String s = cycles.trim();
		int pos = 0;
		while (pos < s.length()) {
			char ch = s.charAt(pos);
			if (Character.isWhitespace(ch)) {
				pos++;
				continue;
			}
			if (ch != '(') {
				throw new PermutationFormatException("Expected '(' at position " + pos + " in " + cycles);
			}
			int close = s.indexOf(')', pos);
			if (close < 0) {
				throw new PermutationFormatException("Unclosed cycle in " + cycles);
			}
			String body = s.substring(pos + 1, close).trim();
			pos = close + 1;
			if (body.isEmpty()) {
				continue;
			}
			String[] parts = body.split("[,\\s]+");
			int[] cycle = new int[parts.length];
			for (int k = 0; k < parts.length; k++) {
				try {
					cycle[k] = Integer.parseInt(parts[k]);
				} catch (NumberFormatException e) {
					throw new PermutationFormatException("Bad point '" + parts[k] + "' in " + cycles, e);
				}
				if (cycle[k] < 1 || cycle[k] > n) {
					throw new PermutationFormatException("Point " + cycle[k] + " outside 1.." + n);
				}
				if (seen[cycle[k]]) {
					throw new PermutationFormatException("Point " + cycle[k] + " occurs twice in " + cycles);
				}
				seen[cycle[k]] = true;
			}
			for (int k = 0; k < cycle.length; k++) {
				img[cycle[k] - 1] = cycle[(k + 1) % cycle.length];
			}
		}
		return new Permutation(img, true);
	}

	private static void validate(int[] img) {
		int n = img.length;
		if (n == 0) {
			throw new PermutationFormatException("Empty permutation");
		}
		boolean[] hit = new boolean[n + 1];
		for (int i = 0; i < n; i++) {
			int v = img[i];
			if (v < 1 || v > n) {
				throw new PermutationFormatException("Image " + v + " of " + (i + 1) + " outside 1.." + n);
			}
			if (hit[v]) {
				throw new PermutationFormatException("Not a bijection: " + v + " is hit twice");
			}
			hit[v] = true;
		}
	}

	public int size() {
		return images.length;
	}

	/** Image of the point {@code i} (1-based). */
	public int apply(int i) {
		return images[i - 1];
	}

	public int[] toArray() {
		return images.clone();
	}

	/** Left-to-right product: first this, then {@code other}. */
	public Permutation multiply(Permutation other) {
		checkSameSize(other);
		int n = images.length;
		int[] r = new int[n];
		for (int i = 0; i < n; i++) {
			r[i] = other.images[images[i] - 1];
		}
		return new Permutation(r, true);
	}

	public Permutation inverse() {
		int n = images.length;
		int[] r = new int[n];
		for (int i = 0; i < n; i++) {
			r[images[i] - 1] = i + 1;
		}
		return new Permutation(r, true);
	}

	/** Integer power; negative exponents invert first. */
	public Permutation pow(long k) {
		Permutation base = k < 0 ? inverse() : this;
		long e = Math.abs(k);
		long ord = order();
		e %= ord;
		Permutation result = identity(images.length);
		while (e > 0) {
			if ((e & 1) == 1) {
				result = result.multiply(base);
			}
			base = base.multiply(base);
			e >>= 1;
		}
		return result;
	}

	/**
	 * Disjoint cycles including fixed points. Each cycle starts at its least
	 * point and lists {@code i, p(i), p(p(i)), ...}; cycles are ordered by their
	 * least point.
	 */
	public List<int[]> cycles() {
		int n = images.length;
		boolean[] done = new boolean[n + 1];
		List<int[]> out = new ArrayList<>();
		for (int i = 1; i <= n; i++) {
			if (done[i]) {
				continue;
			}
			List<Integer> c = new ArrayList<>();
			int j = i;
			while (!done[j]) {
				done[j] = true;
				c.add(j);
				j = images[j - 1];
			}
			out.add(c.stream().mapToInt(Integer::intValue).toArray());
		}
		return Collections.unmodifiableList(out);
	}

	/** Sorted cycle lengths, fixed points included. */
	public int[] cycleType() {
		return cycles().stream().mapToInt(c -> c.length).sorted().toArray();
	}

	/** Least common multiple of the cycle lengths. */
	public long order() {
		long l = 1;
		for (int[] c : cycles()) {
			l = lcm(l, c.length);
		}
		return l;
	}

	public int fixedPointCount() {
		int count = 0;
		for (int i = 0; i < images.length; i++) {
			if (images[i] == i + 1) {
				count++;
			}
		}
		return count;
	}

	public boolean isIdentity() {
		return fixedPointCount() == images.length;
	}

	/**
	 * Whether the group generated by the given permutations has a single orbit
	 * on {1..n}.
	 */
	public static boolean areTransitive(Permutation... generators) {
		if (generators.length == 0) {
			throw new IllegalArgumentException("No generators");
		}
		int n = generators[0].size();
		for (Permutation g : generators) {
			generators[0].checkSameSize(g);
		}
		boolean[] seen = new boolean[n + 1];
		Queue<Integer> queue = new ArrayDeque<>();
		queue.add(1);
		seen[1] = true;
		int reached = 1;
		while (!queue.isEmpty()) {
			int i = queue.poll();
			for (Permutation g : generators) {
				int j = g.apply(i);
				if (!seen[j]) {
					seen[j] = true;
					reached++;
					queue.add(j);
				}
			}
		}
		return reached == n;
	}

	/**
	 * Finds the relabelling {@code σ} with {@code σ(1) = 1} such that
	 * {@code σ(p(i)) = p2(σ(i))} and {@code σ(q(i)) = q2(σ(i))} for all i, i.e.
	 * {@code σ} carries the action of {@code (p, q)} onto that of {@code (p2, q2)}.
	 * The pairs must generate transitive groups.
	 *
	 * @return the relabelling, or null if none exists
	 */
	public static Permutation conjugatorFixingOne(Permutation p, Permutation q, Permutation p2, Permutation q2) {
		int n = p.size();
		if (q.size() != n || p2.size() != n || q2.size() != n) {
			return null;
		}
		int[] sigma = new int[n + 1];
		boolean[] used = new boolean[n + 1];
		sigma[1] = 1;
		used[1] = true;
		Queue<Integer> queue = new ArrayDeque<>();
		queue.add(1);
		Permutation[] from = { p, q };
		Permutation[] to = { p2, q2 };
		while (!queue.isEmpty()) {
			int i = queue.poll();
			for (int g = 0; g < 2; g++) {
				int src = from[g].apply(i);
				int dst = to[g].apply(sigma[i]);
				if (sigma[src] == 0) {
					if (used[dst]) {
						return null;
					}
					sigma[src] = dst;
					used[dst] = true;
					queue.add(src);
				} else if (sigma[src] != dst) {
					return null;
				}
			}
		}
		for (int i = 1; i <= n; i++) {
			if (sigma[i] == 0) {
				return null;
			}
		}
		return new Permutation(Arrays.copyOfRange(sigma, 1, n + 1), true);
	}

	private void checkSameSize(Permutation other) {
		if (other.images.length != images.length) {
			throw new PermutationFormatException(
					"Permutations act on different sets: " + images.length + " vs " + other.images.length);
		}
	}

	static long lcm(long a, long b) {
		return a / gcd(a, b) * b;
	}

	static long gcd(long a, long b) {
		while (b != 0) {
			long t = a % b;
			a = b;
			b = t;
		}
		return Math.abs(a);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Permutation)) {
			return false;
		}
		return Arrays.equals(images, ((Permutation) o).images);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(images);
	}

	/** Cycle notation without fixed points, {@code ()} for the identity. */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int[] c : cycles()) {
			if (c.length == 1) {
				continue;
			}
			sb.append('(');
			for (int k = 0; k < c.length; k++) {
				if (k > 0) {
					sb.append(',');
				}
				sb.append(c[k]);
			}
			sb.append(')');
		}
		return sb.length() == 0 ? "()" : sb.toString();
	}
}
