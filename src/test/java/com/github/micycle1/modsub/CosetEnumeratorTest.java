package com.github.micycle1.modsub;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.modsub.group.CongruenceSubgroup;
import com.github.micycle1.modsub.group.Gamma0;
import com.github.micycle1.modsub.perm.Permutation;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

public class CosetEnumeratorTest {

	@Test
	public void testRepresentativesFromPermutations() {
		Permutation s = Permutation.parseCycles("(1,2)(3,4)(5,6)", 6);
		Permutation r = Permutation.parseCycles("(1,3,2)(4,5,6)", 6);
		List<SL2ZElement> reps = CosetEnumerator.fromPermutations(s, r);
		List<SL2ZElement> expected = List.of(SL2ZElement.IDENTITY, SL2ZElement.S, new SL2ZElement(0, -1, 1, 1),
				new SL2ZElement(0, -1, 1, -1), new SL2ZElement(0, -1, 1, 2), new SL2ZElement(-1, 0, 2, -1));
		assertEquals(expected, reps);
	}

	@Test
	public void testCyclesJoinedThroughS() {
		Permutation s = Permutation.parseCycles("(2,3)(4,5)(6,7)", 7);
		Permutation r = Permutation.parseCycles("(1,3,4)(5,6,7)", 7);
		List<SL2ZElement> reps = CosetEnumerator.fromPermutations(s, r);
		assertEquals(SL2ZElement.translation(2), reps.get(1));
		assertEquals(SL2ZElement.translation(3), reps.get(3));
		assertEquals(SL2ZElement.translation(-1), reps.get(4));
		assertEquals(new SL2ZElement(-2, -1, 1, 0), reps.get(6));
	}

	@Test
	public void testUnreachableCycles() {
		Permutation s = Permutation.parseCycles("(1,2)", 4);
		CosetEnumerationException e = assertThrows(CosetEnumerationException.class,
				() -> CosetEnumerator.fromPermutations(s, Permutation.identity(4)));
		assertEquals(2, e.getPartialRepresentatives().size());
	}

	@Test
	public void testRepresentativesOfGamma0() {
		List<SL2ZElement> reps = CosetEnumerator.fromCongruenceSubgroup(new Gamma0(5));
		List<SL2ZElement> expected = List.of(SL2ZElement.IDENTITY, SL2ZElement.S, new SL2ZElement(0, -1, 1, -2),
				new SL2ZElement(0, -1, 1, -1), new SL2ZElement(0, -1, 1, 1), new SL2ZElement(0, -1, 1, 2));
		assertEquals(expected, reps);

		Permutation[] sr = CosetEnumerator.actionOn(reps, new Gamma0(5)::contains);
		assertArrayEquals(new int[] { 2, 1, 3, 5, 4, 6 }, sr[0].toArray());
		assertArrayEquals(new int[] { 5, 1, 4, 6, 2, 3 }, sr[1].toArray());
	}

	@Test
	public void testIndexTooLarge() {
		// the whole modular group claiming index 2
		CongruenceSubgroup everything = new CongruenceSubgroup() {
			@Override
			public int index() {
				return 2;
			}

			@Override
			public int level() {
				return 1;
			}

			@Override
			public boolean contains(SL2ZElement m) {
				return true;
			}

			@Override
			public Permutation[] generatingPermutations() {
				return new Permutation[] { Permutation.identity(2), Permutation.identity(2) };
			}
		};
		CosetEnumerationException e = assertThrows(CosetEnumerationException.class,
				() -> CosetEnumerator.fromCongruenceSubgroup(everything));
		assertEquals(List.of(SL2ZElement.IDENTITY), e.getPartialRepresentatives());
	}

	@Test
	public void testMismatchedGeneratingPermutations() {
		Gamma0 real = new Gamma0(5);
		CongruenceSubgroup liar = new CongruenceSubgroup() {
			@Override
			public int index() {
				return real.index();
			}

			@Override
			public int level() {
				return real.level();
			}

			@Override
			public boolean contains(SL2ZElement m) {
				return real.contains(m);
			}

			@Override
			public Permutation[] generatingPermutations() {
				return new Permutation[] { Permutation.identity(6), Permutation.identity(6) };
			}
		};
		assertThrows(ConsistencyException.class, () -> ModularSubgroup.fromCongruenceSubgroup(liar));
	}
}
