package com.github.micycle1.modsub;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.modsub.perm.Permutation;
import com.github.micycle1.modsub.sl2z.Cusp;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * <p>
 * Derives vertices, cusps and the signature from coset representatives.
 * </p>
 *
 * <p>
 * Cusps correspond to the cycles of {@code permT}: the cusp {@code M(∞)} belongs
 * to the cycle through the coset {@code 1·M}. A vertex {@code V_j(∞)} is thus
 * equivalent to a known cusp with normalizer {@code N} exactly when j and
 * {@code 1·N} share a cycle, and then {@code U = N·T^k·V_j⁻¹} with
 * {@code (1·N)·T^k = j} is a group element sending the vertex to the cusp.
 * </p>
 *
 * <p>
 * For Γ0(N) new cusps are canonicalized to 0 or {@code 1/d} with
 * {@code d = gcd(q, N)} whenever that candidate lies in the right class;
 * otherwise the vertex itself is canonical with normalizer {@code V_j}.
 * Coset representatives are never modified.
 * </p>
 */
final class FundamentalDomainBuilder {

	private static final Logger LOG = LoggerFactory.getLogger(FundamentalDomainBuilder.class);

	private final List<SL2ZElement> reps;
	private final Permutation permS;
	private final Permutation permR;
	private final CosetAction action;
	private final Predicate<SL2ZElement> group;
	private final int gamma0Level;

	/**
	 * @param gamma0Level the level N when the group is Γ0(N), otherwise 0
	 */
	FundamentalDomainBuilder(List<SL2ZElement> reps, Permutation permS, Permutation permR, CosetAction action,
			Predicate<SL2ZElement> group, int gamma0Level) {
		this.reps = reps;
		this.permS = permS;
		this.permR = permR;
		this.action = action;
		this.group = group;
		this.gamma0Level = gamma0Level;
	}

	FundamentalDomain build() {
		List<Cusp> values = new ArrayList<>();
		List<List<Integer>> cosetsOf = new ArrayList<>();
		collectVertices(values, cosetsOf);

		// per T-cycle: canonical value, normalizer, coset label
		Map<Integer, Integer> cuspOfCycle = new LinkedHashMap<>();
		List<Cusp> cuspValues = new ArrayList<>();
		List<SL2ZElement> normalizers = new ArrayList<>();
		List<Integer> labels = new ArrayList<>();
		List<List<Integer>> cuspVertices = new ArrayList<>();

		int[] vertexCusp = new int[values.size()];
		SL2ZElement[] vertexMaps = new SL2ZElement[values.size()];
		for (int v = 0; v < values.size(); v++) {
			Cusp value = values.get(v);
			int j = cosetsOf.get(v).get(0);
			int cycle = action.cycleIndex(j);
			Integer cusp = cuspOfCycle.get(cycle);
			if (cusp == null) {
				cusp = cuspValues.size();
				cuspOfCycle.put(cycle, cusp);
				newCusp(value, j, cycle, cuspValues, normalizers, labels);
				cuspVertices.add(new ArrayList<>());
				LOG.debug("Vertex {} starts cusp {} = {}", value, cusp, cuspValues.get(cusp));
			}
			cuspVertices.get(cusp).add(v);
			vertexCusp[v] = cusp;
			vertexMaps[v] = value.equals(cuspValues.get(cusp)) ? SL2ZElement.IDENTITY
					: mapToCusp(reps.get(j - 1), j, normalizers.get(cusp), labels.get(cusp));
			if (!action.fixesBase(vertexMaps[v])) {
				throw new ConsistencyException("Cusp map " + vertexMaps[v] + " of vertex " + value + " is not in the group");
			}
		}

		if (cuspValues.size() != action.cycleCount()) {
			throw new ConsistencyException(
					"Found " + cuspValues.size() + " cusps but permT has " + action.cycleCount() + " cycles");
		}

		int[] order = cuspOrder(cuspValues);
		int[] rank = new int[order.length];
		for (int k = 0; k < order.length; k++) {
			rank[order[k]] = k;
		}
		List<CuspData> cusps = new ArrayList<>();
		for (int k = 0; k < order.length; k++) {
			int c = order[k];
			SL2ZElement nc = normalizers.get(c);
			int width = action.cycleLength(labels.get(c));
			SL2ZElement stabilizer = SL2ZElement.translation(width).conjugateBy(nc);
			if (!group.test(stabilizer)) {
				throw new ConsistencyException("Stabilizer " + stabilizer + " of cusp " + cuspValues.get(c)
						+ " is not in the group");
			}
			cusps.add(new CuspData(k, cuspValues.get(c), nc, width, stabilizer, labels.get(c), cuspVertices.get(c)));
		}

		List<Vertex> vertices = new ArrayList<>();
		for (int v = 0; v < values.size(); v++) {
			CuspData cusp = cusps.get(rank[vertexCusp[v]]);
			vertices.add(new Vertex(v, values.get(v), cosetsOf.get(v), cusp.index, vertexMaps[v], cusp.width));
		}

		Signature signature = Signature.of(reps.size(), cusps.size(), permS.fixedPointCount(), permR.fixedPointCount());
		LOG.debug("{} vertices, {} cusps, {}", vertices.size(), cusps.size(), signature);
		return new FundamentalDomain(vertices, cusps, signature);
	}

	// distinct V_j(∞) in coset order, with 0 moved directly after infinity
	private void collectVertices(List<Cusp> values, List<List<Integer>> cosetsOf) {
		Map<Cusp, List<Integer>> byValue = new LinkedHashMap<>();
		for (int j = 1; j <= reps.size(); j++) {
			Cusp v = reps.get(j - 1).apply(Cusp.INFINITY);
			byValue.computeIfAbsent(v, k -> new ArrayList<>()).add(j);
		}
		List<Integer> zero = byValue.remove(Cusp.ZERO);
		List<Integer> inf = byValue.remove(Cusp.INFINITY);
		values.add(Cusp.INFINITY);
		cosetsOf.add(inf);
		if (zero != null) {
			values.add(Cusp.ZERO);
			cosetsOf.add(zero);
		}
		for (Map.Entry<Cusp, List<Integer>> e : byValue.entrySet()) {
			values.add(e.getKey());
			cosetsOf.add(e.getValue());
		}
	}

	private void newCusp(Cusp value, int j, int cycle, List<Cusp> cuspValues, List<SL2ZElement> normalizers,
			List<Integer> labels) {
		if (value.isInfinity()) {
			cuspValues.add(Cusp.INFINITY);
			normalizers.add(SL2ZElement.IDENTITY);
			labels.add(1);
			return;
		}
		if (gamma0Level > 1) {
			long d = gcd(value.q, gamma0Level);
			Cusp candidate = d == 1 ? Cusp.ZERO : Cusp.of(1, d);
			SL2ZElement normalizer = d == 1 ? SL2ZElement.S : new SL2ZElement(1, 0, d, 1);
			int label = action.act(1, normalizer);
			if (action.cycleIndex(label) == cycle) {
				cuspValues.add(candidate);
				normalizers.add(normalizer);
				labels.add(label);
				return;
			}
		}
		cuspValues.add(value);
		normalizers.add(reps.get(j - 1));
		labels.add(j);
	}

	/**
	 * {@code N·T^k·M⁻¹}, where {@code M} has coset {@code coset} and the
	 * normalizer {@code N} has coset {@code label} in the same T-cycle. The
	 * result lies in the group and sends {@code M(∞)} to {@code N(∞)}.
	 */
	SL2ZElement mapToCusp(SL2ZElement m, int coset, SL2ZElement normalizer, int label) {
		int k = action.translationExponent(label, coset);
		return normalizer.multiply(SL2ZElement.translation(k)).multiply(m.inverse());
	}

	// infinity first, 0 second, others in discovery order
	private static int[] cuspOrder(List<Cusp> values) {
		int[] order = new int[values.size()];
		int pos = 0;
		Map<Integer, Boolean> used = new HashMap<>();
		for (Cusp special : new Cusp[] { Cusp.INFINITY, Cusp.ZERO }) {
			int idx = values.indexOf(special);
			if (idx >= 0) {
				order[pos++] = idx;
				used.put(idx, true);
			}
		}
		for (int k = 0; k < values.size(); k++) {
			if (!used.containsKey(k)) {
				order[pos++] = k;
			}
		}
		return order;
	}

	static long gcd(long a, long b) {
		a = Math.abs(a);
		b = Math.abs(b);
		while (b != 0) {
			long t = a % b;
			a = b;
			b = t;
		}
		return a;
	}
}
