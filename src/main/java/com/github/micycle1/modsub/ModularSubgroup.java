package com.github.micycle1.modsub;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.ejml.data.Complex_F64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.modsub.group.CongruenceSubgroup;
import com.github.micycle1.modsub.perm.Permutation;
import com.github.micycle1.modsub.perm.PermutationFormatException;
import com.github.micycle1.modsub.sl2z.Cusp;
import com.github.micycle1.modsub.sl2z.SL2ZElement;
import com.github.micycle1.modsub.sl2z.SL2ZModN;

/**
 * <p>
 * A finite-index subgroup G of the modular group PSL(2,Z), described by the
 * right action of {@code S = [[0,-1],[1,0]]} and {@code R = S·T} on its cosets
 * {1..n}, coset 1 being G itself.
 * </p>
 *
 * <p>
 * What:
 * </p>
 * <ul>
 * <li>Coset representatives {@code V_1 = I, ..., V_n} with {@code 1·V_j = j}
 * (see {@link CosetEnumerator}).</li>
 * <li>The fundamental domain: vertices {@code V_j(∞)}, inequivalent cusps with
 * normalizers, widths and stabilizers, and the signature (see
 * {@link FundamentalDomainBuilder}).</li>
 * <li>Pullback of points into the fundamental domain and closest vertex/cusp
 * queries.</li>
 * <li>Congruence tests, generators, normalizer data and the reflected
 * group.</li>
 * </ul>
 *
 * <p>
 * Important assumptions & notes:
 * </p>
 * <ul>
 * <li>Permutations are multiplied left to right, so that {@code A ↦ π(A)} is a
 * homomorphism and {@code A ∈ G} exactly when {@code 1·A = 1}.</li>
 * <li>Cusp 0 and vertex 0 are infinity; cusp 1 and vertex 1 are 0 whenever 0 is
 * a cusp of the group.</li>
 * <li>Instances are immutable apart from memoized derived data, computed once
 * on first use. The class is not thread-safe; callers should synchronize
 * externally if needed.</li>
 * </ul>
 */
public class ModularSubgroup {

	private static final Logger LOG = LoggerFactory.getLogger(ModularSubgroup.class);

	private final Permutation permS;
	private final Permutation permR;
	private final Permutation permT;
	private final Permutation permP;
	private final int index;
	private final SubgroupOrigin origin;
	private final Predicate<SL2ZElement> membership;
	private final CosetAction action;
	private final List<SL2ZElement> reps;
	private final int generalisedLevel;
	private final boolean gamma0;
	private final FundamentalDomain domain;
	private final FundamentalDomainBuilder builder;
	private final Pullback pullback;
	// cusp index per permT-cycle
	private final int[] cuspOfCycle;
	// N_c⁻¹·U_v per vertex
	private final SL2ZElement[] vertexNormalizers;

	// memoized
	private List<SL2ZElement> generators;
	private Boolean congruence;
	private Boolean symmetric;
	private final Map<Integer, NormalizerOrder> normalizerOrders = new HashMap<>();
	private final Map<Integer, Boolean> symmetrizable = new HashMap<>();

	private ModularSubgroup(Permutation permS, Permutation permR, List<SL2ZElement> reps, SubgroupOrigin origin,
			Predicate<SL2ZElement> membership) {
		this.permS = permS;
		this.permR = permR;
		this.permT = permS.multiply(permR);
		this.permP = permT.multiply(permS).multiply(permT);
		this.index = permS.size();
		this.origin = origin;
		this.action = new CosetAction(permS, permT);
		this.membership = membership != null ? membership : action::fixesBase;
		this.reps = Collections.unmodifiableList(new ArrayList<>(reps));
		checkRepresentatives();
		this.generalisedLevel = Math.toIntExact(permT.order());
		this.gamma0 = origin.getCongruenceSubgroup().map(CongruenceSubgroup::isGamma0).orElseGet(this::detectGamma0);

		this.builder = new FundamentalDomainBuilder(this.reps, permS, permR, action, this.membership,
				gamma0 ? generalisedLevel : 0);
		this.domain = builder.build();
		this.cuspOfCycle = new int[action.cycleCount()];
		for (CuspData c : domain.getCusps()) {
			cuspOfCycle[action.cycleIndex(c.cosetLabel)] = c.index;
		}
		this.vertexNormalizers = new SL2ZElement[domain.getVertices().size()];
		for (Vertex v : domain.getVertices()) {
			vertexNormalizers[v.index] = getCuspData(v.cuspIndex).normalizer.inverse().multiply(v.cuspMap);
		}

		CosetLocator locator = gamma0 && generalisedLevel > 1 ? CosetLocator.forGamma0(this.reps, generalisedLevel)
				: CosetLocator.of(action);
		this.pullback = new Pullback(this.reps, locator, this.membership);
		LOG.debug("Constructed subgroup of index {} from {}: {}", index, origin, domain.getSignature());
	}

	/**
	 * The subgroup whose coset action is given by {@code permS} (order dividing
	 * 2) and {@code permR} (order dividing 3).
	 *
	 * @throws PermutationFormatException if the permutations have different
	 *                                    sizes
	 * @throws ConsistencyException       if they have the wrong orders or do
	 *                                    not act transitively
	 */
	public static ModularSubgroup fromPermutations(Permutation permS, Permutation permR) {
		Objects.requireNonNull(permS, "permS");
		Objects.requireNonNull(permR, "permR");
		validate(permS, permR);
		List<SL2ZElement> reps = CosetEnumerator.fromPermutations(permS, permR);
		return new ModularSubgroup(permS, permR, reps, SubgroupOrigin.PERMUTATIONS, null);
	}

	public static ModularSubgroup fromPermutations(int[] permS, int[] permR) {
		return fromPermutations(new Permutation(permS), new Permutation(permR));
	}

	/**
	 * The subgroup described by an external congruence subgroup. Coset
	 * representatives are enumerated through its membership test and the coset
	 * action is derived from them.
	 *
	 * @throws ConsistencyException if the derived action disagrees with the
	 *                              group's generating permutations
	 */
	public static ModularSubgroup fromCongruenceSubgroup(CongruenceSubgroup group) {
		Objects.requireNonNull(group, "group");
		List<SL2ZElement> reps = CosetEnumerator.fromCongruenceSubgroup(group);
		Permutation[] sr = CosetEnumerator.actionOn(reps, group::contains);
		CosetEnumerator.checkAgainst(sr[0], sr[1], group.generatingPermutations());
		return new ModularSubgroup(sr[0], sr[1], reps, SubgroupOrigin.of(group), group::contains);
	}

	/** The full modular group, of index 1. */
	public static ModularSubgroup modularGroup() {
		return fromPermutations(Permutation.identity(1), Permutation.identity(1));
	}

	private static void validate(Permutation permS, Permutation permR) {
		if (permS.size() != permR.size()) {
			throw new PermutationFormatException(
					"permS and permR act on different sets: " + permS.size() + " vs " + permR.size());
		}
		if (!permS.pow(2).isIdentity()) {
			throw new ConsistencyException("permS = " + permS + " does not have order dividing 2");
		}
		if (!permR.pow(3).isIdentity()) {
			throw new ConsistencyException("permR = " + permR + " does not have order dividing 3");
		}
		if (!Permutation.areTransitive(permS, permR)) {
			throw new ConsistencyException("permS = " + permS + " and permR = " + permR + " are not transitive");
		}
	}

	private void checkRepresentatives() {
		if (reps.size() != index || !reps.get(0).isIdentityUpToSign()) {
			throw new ConsistencyException("Representatives must start with the identity and number " + index);
		}
		for (int j = 1; j <= index; j++) {
			int image = action.act(1, reps.get(j - 1));
			if (image != j) {
				throw new ConsistencyException("Representative " + reps.get(j - 1) + " sends 1 to " + image + ", not " + j);
			}
		}
	}

	private boolean detectGamma0() {
		int n = generalisedLevel;
		if (SL2ZModN.gamma0Index(n) != index) {
			return false;
		}
		for (SL2ZElement g : getGenerators()) {
			if (SL2ZModN.mod(g.c, n) != 0) {
				return false;
			}
		}
		return true;
	}

	// ---- combinatorial data ----

	public int getIndex() {
		return index;
	}

	public Permutation getPermS() {
		return permS;
	}

	public Permutation getPermR() {
		return permR;
	}

	/** {@code π(T) = permS·permR}. */
	public Permutation getPermT() {
		return permT;
	}

	/** {@code permT·permS·permT}. */
	public Permutation getPermP() {
		return permP;
	}

	public SubgroupOrigin getOrigin() {
		return origin;
	}

	/** {@code V_1, ..., V_n}; element {@code j-1} is {@code V_j}. */
	public List<SL2ZElement> getCosetRepresentatives() {
		return reps;
	}

	public FundamentalDomain getFundamentalDomain() {
		return domain;
	}

	public Signature getSignature() {
		return domain.getSignature();
	}

	public List<Vertex> getVertices() {
		return domain.getVertices();
	}

	/** Canonical values of the inequivalent cusps. */
	public List<Cusp> getCusps() {
		return domain.getCusps().stream().map(c -> c.value).collect(Collectors.toList());
	}

	public List<CuspData> getCuspData() {
		return domain.getCusps();
	}

	public CuspData getCuspData(int cusp) {
		return domain.getCusps().get(cusp);
	}

	/** Least common multiple of the cusp widths. */
	public int getGeneralisedLevel() {
		return generalisedLevel;
	}

	// ---- membership and coset action ----

	public boolean contains(SL2ZElement m) {
		return membership.test(m);
	}

	public Predicate<SL2ZElement> getMembershipTest() {
		return membership;
	}

	/** {@code π(A)}, the permutation of the cosets induced by A. */
	public Permutation permutationAction(SL2ZElement m) {
		return action.permutation(m);
	}

	/** The coset j with {@code G·A = G·V_j}. */
	public int cosetIndex(SL2ZElement m) {
		return action.act(1, m);
	}

	/** The representative {@code V_j} with {@code A·V_j⁻¹ ∈ G}. */
	public SL2ZElement cosetRepresentative(SL2ZElement m) {
		return reps.get(cosetIndex(m) - 1);
	}

	/**
	 * Schreier generators {@code V_i·X·V_{i·X}⁻¹} for {@code X ∈ {S, R}}, without
	 * {@code ±I} and without repeats up to sign and inversion.
	 */
	public List<SL2ZElement> getGenerators() {
		if (generators == null) {
			List<SL2ZElement> gens = new ArrayList<>();
			Set<SL2ZElement> seen = new HashSet<>();
			SL2ZElement[] xs = { SL2ZElement.S, SL2ZElement.R };
			Permutation[] px = { permS, permR };
			for (int i = 1; i <= index; i++) {
				for (int k = 0; k < 2; k++) {
					int j = px[k].apply(i);
					SL2ZElement g = reps.get(i - 1).multiply(xs[k]).multiply(reps.get(j - 1).inverse());
					if (g.isIdentityUpToSign()) {
						continue;
					}
					SL2ZElement key = g.normalizedSign();
					SL2ZElement invKey = g.inverse().normalizedSign();
					if (seen.contains(key) || seen.contains(invKey)) {
						continue;
					}
					seen.add(key);
					gens.add(g);
				}
			}
			generators = Collections.unmodifiableList(gens);
		}
		return generators;
	}

	/** Whether {@code A·g·A⁻¹} lies in the group for every generator g. */
	public boolean isNormalizer(SL2ZElement a) {
		for (SL2ZElement g : getGenerators()) {
			if (!contains(g.conjugateBy(a))) {
				return false;
			}
		}
		return true;
	}

	// ---- congruence ----

	/**
	 * Whether the group contains the principal congruence subgroup of its
	 * generalised level. Decided by comparing the order of its image in
	 * SL(2, Z/N) with {@code |SL(2, Z/N)| / index}.
	 */
	public boolean isCongruence() {
		if (congruence == null) {
			if (origin.getKind() == SubgroupOrigin.Kind.CONGRUENCE || gamma0) {
				congruence = true;
			} else {
				int n = generalisedLevel;
				long total = SL2ZModN.sl2Order(n);
				if (total % index != 0) {
					congruence = false;
				} else {
					List<SL2ZElement> gens = new ArrayList<>(getGenerators());
					gens.add(SL2ZElement.MINUS_IDENTITY);
					long expected = total / index;
					long order = SL2ZModN.closureOrder(gens, n, expected);
					congruence = order == expected;
					if (order < 0 && expected > SL2ZModN.MAX_CLOSURE_SIZE) {
						LOG.warn("Image in SL(2, Z/{}) exceeds the closure cap of {} elements; reporting non-congruence", n,
								SL2ZModN.MAX_CLOSURE_SIZE);
					} else if (order < 0) {
						LOG.debug("Image in SL(2, Z/{}) exceeds {} elements", n, expected);
					}
				}
			}
		}
		return congruence;
	}

	public boolean isGamma0() {
		return gamma0;
	}

	/**
	 * @throws IllegalStateException if the group is not a congruence subgroup
	 */
	public int getLevel() {
		if (!isCongruence()) {
			throw new IllegalStateException("Level is only defined for congruence subgroups");
		}
		return generalisedLevel;
	}

	// ---- symmetry ----

	/**
	 * The image of the group under the reflection {@code z ↦ -z̄}, with coset
	 * action {@code (permS, permS·permR²·permS)}.
	 */
	public ModularSubgroup reflectedGroup() {
		return fromPermutations(permS, reflectedPermR());
	}

	private Permutation reflectedPermR() {
		return permS.multiply(permR.pow(2)).multiply(permS);
	}

	/** Whether the reflected group coincides with the group. */
	public boolean isSymmetric() {
		if (symmetric == null) {
			symmetric = Permutation.conjugatorFixingOne(permS, permR, permS, reflectedPermR()) != null;
		}
		return symmetric;
	}

	/**
	 * Whether the normalizer {@code N} of the cusp can be chosen compatibly with
	 * {@code z ↦ -z̄}: for Γ0(N) when N divides {@code 2cd}, for other symmetric
	 * groups when {@code [[ad+bc, -2ab], [-2cd, ad+bc]]} lies in the group.
	 */
	public boolean isSymmetrizable(int cusp) {
		return symmetrizable.computeIfAbsent(cusp, k -> {
			SL2ZElement n = getCuspData(k).normalizer;
			if (gamma0) {
				return SL2ZModN.mod(n.c.multiply(n.d).shiftLeft(1), generalisedLevel) == 0;
			}
			if (isSymmetric()) {
				BigInteger t = n.a.multiply(n.d).add(n.b.multiply(n.c));
				SL2ZElement m = new SL2ZElement(t, n.a.multiply(n.b).shiftLeft(1).negate(),
						n.c.multiply(n.d).shiftLeft(1).negate(), t);
				return contains(m);
			}
			return false;
		});
	}

	/**
	 * Atkin–Lehner type data of the cusp normalizer; {@link NormalizerOrder#UNKNOWN}
	 * for groups other than Γ0(N).
	 */
	public NormalizerOrder normalizerOrder(int cusp) {
		if (!gamma0) {
			return NormalizerOrder.UNKNOWN;
		}
		return normalizerOrders.computeIfAbsent(cusp,
				k -> NormalizerOrder.forGamma0Cusp(getCuspData(k), generalisedLevel, membership));
	}

	// ---- cusps ----

	/** Result of {@link #cuspEquivalentTo}: a cusp index and a group element. */
	public static final class CuspEquivalence {
		public final int cusp;
		/** Group element sending the queried cusp to the canonical one. */
		public final SL2ZElement map;

		CuspEquivalence(int cusp, SL2ZElement map) {
			this.cusp = cusp;
			this.map = map;
		}
	}

	/** Normalizer data of an arbitrary cusp. */
	public static final class CuspNormalizer {
		/** Maps infinity to the cusp. */
		public final SL2ZElement normalizer;
		public final int width;
		/** Always +1: {@code -I} acts trivially, so no cusp is irregular. */
		public final int sign;

		CuspNormalizer(SL2ZElement normalizer, int width, int sign) {
			this.normalizer = normalizer;
			this.width = width;
			this.sign = sign;
		}
	}

	/** The inequivalent cusp equivalent to {@code c}, and a group element mapping c onto it. */
	public CuspEquivalence cuspEquivalentTo(Cusp c) {
		Objects.requireNonNull(c, "c");
		SL2ZElement lift = SL2ZElement.lift(c);
		int coset = action.act(1, lift);
		int k = cuspOfCycle[action.cycleIndex(coset)];
		CuspData cusp = getCuspData(k);
		if (cusp.value.equals(c)) {
			return new CuspEquivalence(k, SL2ZElement.IDENTITY);
		}
		return new CuspEquivalence(k, builder.mapToCusp(lift, coset, cusp.normalizer, cusp.cosetLabel));
	}

	public boolean areEquivalentCusps(Cusp c1, Cusp c2) {
		int k1 = action.cycleIndex(action.act(1, SL2ZElement.lift(c1)));
		int k2 = action.cycleIndex(action.act(1, SL2ZElement.lift(c2)));
		return k1 == k2;
	}

	/** Normalizer {@code U⁻¹·N} of c, where U maps c to its canonical cusp with normalizer N. */
	public CuspNormalizer cuspData(Cusp c) {
		CuspEquivalence eq = cuspEquivalentTo(c);
		CuspData cusp = getCuspData(eq.cusp);
		return new CuspNormalizer(eq.map.inverse().multiply(cusp.normalizer), cusp.width, 1);
	}

	public int cuspWidth(Cusp c) {
		return getCuspData(cuspEquivalentTo(c).cusp).width;
	}

	public SL2ZElement cuspNormalizer(Cusp c) {
		return cuspData(c).normalizer;
	}

	/** Generator {@code N·T^w·N⁻¹} of the stabilizer of c in the group. */
	public SL2ZElement cuspStabilizer(Cusp c) {
		CuspNormalizer data = cuspData(c);
		return SL2ZElement.translation(data.width).conjugateBy(data.normalizer);
	}

	/** Lower bound for the invariant height of points of the fundamental domain. */
	public double minimalHeight() {
		int maxWidth = 1;
		for (CuspData c : domain.getCusps()) {
			maxWidth = Math.max(maxWidth, c.width);
		}
		return Math.sqrt(3.0) / (2.0 * maxWidth);
	}

	/** Local coordinate {@code N⁻¹(z)/w} of z at the cusp. */
	public Complex_F64 normalizeToCusp(double x, double y, int cusp) {
		CuspData c = getCuspData(cusp);
		Complex_F64 w = c.normalizer.inverse().apply(new Complex_F64(x, y));
		return new Complex_F64(w.real / c.width, w.imaginary / c.width);
	}

	/** Inverse of {@link #normalizeToCusp}: {@code N(w·z)}. */
	public Complex_F64 fromCuspCoordinate(double x, double y, int cusp) {
		CuspData c = getCuspData(cusp);
		return c.normalizer.apply(new Complex_F64(x * c.width, y * c.width));
	}

	// ---- pullback and closest vertex ----

	public Pullback.Result pullback(double x, double y) {
		return pullback.pullback(x, y);
	}

	/**
	 * Pullback in {@code precisionBits} binary digits; double arithmetic is used
	 * up to {@link Pullback#DOUBLE_PRECISION_BITS}.
	 */
	public Pullback.PreciseResult pullback(BigDecimal x, BigDecimal y, int precisionBits) {
		return pullback.pullback(x, y, precisionBits);
	}

	/** {@code Im(N_c⁻¹·U_v(z)) / w_c} for vertex v with cusp c. */
	public double vertexHeight(int vertex, double x, double y) {
		SL2ZElement sigma = vertexNormalizers[vertex];
		double cx = sigma.c.doubleValue() * x + sigma.d.doubleValue();
		double cy = sigma.c.doubleValue() * y;
		return y / (cx * cx + cy * cy) / domain.getVertices().get(vertex).width;
	}

	/**
	 * Index of the vertex at which z has the largest scaled height; ties go to
	 * the lowest index.
	 */
	public int closestVertex(double x, double y) {
		if (!(y > 0)) {
			throw new IllegalArgumentException("Point must lie in the upper half-plane, got y = " + y);
		}
		int best = 0;
		double bestHeight = vertexHeight(0, x, y);
		for (int v = 1; v < vertexNormalizers.length; v++) {
			double h = vertexHeight(v, x, y);
			if (h > bestHeight) {
				best = v;
				bestHeight = h;
			}
		}
		return best;
	}

	/** Index of the cusp of the closest vertex. */
	public int closestCusp(double x, double y) {
		return domain.getVertices().get(closestVertex(x, y)).cuspIndex;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ModularSubgroup)) {
			return false;
		}
		ModularSubgroup g = (ModularSubgroup) o;
		return permS.equals(g.permS) && permR.equals(g.permR);
	}

	@Override
	public int hashCode() {
		return Objects.hash(permS, permR);
	}

	@Override
	public String toString() {
		return "ModularSubgroup[index=" + index + ", permS=" + permS + ", permR=" + permR + "]";
	}
}
