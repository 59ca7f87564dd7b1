package com.github.micycle1.modsub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.data.Complex_F64;
import org.junit.jupiter.api.Test;

import com.github.micycle1.modsub.group.Gamma0;
import com.github.micycle1.modsub.sl2z.Cusp;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

public class CuspQueryTest {

	private static final Cusp[] CUSPS = { Cusp.INFINITY, Cusp.ZERO, Cusp.of(1, 4), Cusp.of(-1, 2), Cusp.of(1, 3),
			Cusp.of(2, 5), Cusp.of(7, 12), Cusp.of(-13, 8), Cusp.of(5) };

	@Test
	public void testEquivalenceClassesOfGamma0Four() {
		ModularSubgroup g = ModularSubgroupTest.indexSix();
		assertEquals(0, g.cuspEquivalentTo(Cusp.of(1, 4)).cusp);
		assertEquals(0, g.cuspEquivalentTo(Cusp.of(3, 4)).cusp);
		assertTrue(g.areEquivalentCusps(Cusp.of(1, 4), Cusp.INFINITY));
		// T lies in the group, so every integer is equivalent to 0
		assertEquals(1, g.cuspEquivalentTo(Cusp.of(5)).cusp);
		assertEquals(1, g.cuspEquivalentTo(Cusp.of(1, 3)).cusp);
		assertEquals(2, g.cuspEquivalentTo(Cusp.of(-1, 2)).cusp);
		assertTrue(g.areEquivalentCusps(Cusp.of(1, 3), Cusp.of(2, 5)));
		assertFalse(g.areEquivalentCusps(Cusp.of(1, 2), Cusp.ZERO));
		assertEquals(4, g.cuspWidth(Cusp.of(1, 3)));
		assertEquals(1, g.cuspWidth(Cusp.of(-13, 8)));
	}

	@Test
	public void testCanonicalCuspIsItsOwnRepresentative() {
		ModularSubgroup g = ModularSubgroup.fromCongruenceSubgroup(new Gamma0(6));
		for (int k = 0; k < g.getCuspData().size(); k++) {
			ModularSubgroup.CuspEquivalence eq = g.cuspEquivalentTo(g.getCusps().get(k));
			assertEquals(k, eq.cusp);
			assertEquals(SL2ZElement.IDENTITY, eq.map);
		}
	}

	@Test
	public void testMapsNormalizersAndStabilizers() {
		ModularSubgroup[] groups = { ModularSubgroupTest.indexSix(), ModularSubgroupTest.indexSeven(),
				ModularSubgroup.fromCongruenceSubgroup(new Gamma0(6)) };
		for (ModularSubgroup g : groups) {
			for (Cusp c : CUSPS) {
				ModularSubgroup.CuspEquivalence eq = g.cuspEquivalentTo(c);
				assertTrue(g.contains(eq.map));
				assertEquals(g.getCusps().get(eq.cusp), eq.map.apply(c));

				ModularSubgroup.CuspNormalizer n = g.cuspData(c);
				assertEquals(c, n.normalizer.apply(Cusp.INFINITY));
				assertEquals(1, n.sign);

				SL2ZElement stab = g.cuspStabilizer(c);
				assertTrue(g.contains(stab), g + " " + c);
				assertEquals(c, stab.apply(c));
				// the width is minimal: no smaller translation at c lies in the group
				for (int w = 1; w < n.width; w++) {
					assertFalse(g.contains(SL2ZElement.translation(w).conjugateBy(n.normalizer)));
				}
			}
		}
	}

	@Test
	public void testLocalCoordinates() {
		ModularSubgroup g = ModularSubgroup.fromCongruenceSubgroup(new Gamma0(6));
		for (int k = 0; k < g.getCuspData().size(); k++) {
			Complex_F64 local = g.normalizeToCusp(0.31, 0.07, k);
			Complex_F64 back = g.fromCuspCoordinate(local.real, local.imaginary, k);
			assertEquals(0.31, back.real, 1e-12);
			assertEquals(0.07, back.imaginary, 1e-12);
		}
		// at infinity of width one the local coordinate is z itself
		Complex_F64 atInfinity = g.normalizeToCusp(0.31, 0.07, 0);
		assertEquals(0.31, atInfinity.real, 1e-15);
		assertEquals(0.07, atInfinity.imaginary, 1e-15);
	}

	@Test
	public void testClosestVertexOfGamma0Five() {
		ModularSubgroup g = ModularSubgroup.fromCongruenceSubgroup(new Gamma0(5));
		assertEquals(0, g.closestVertex(0.3, 5.0));
		assertEquals(0, g.closestCusp(0.3, 5.0));
		assertEquals(1, g.closestVertex(0.01, 0.01));
		assertEquals(1, g.closestCusp(0.01, 0.01));
	}
}
