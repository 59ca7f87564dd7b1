package com.github.micycle1.modsub.sl2z;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.MathContext;

import org.ejml.data.Complex_F64;
import org.junit.jupiter.api.Test;

public class PSL2ZReductionTest {

	@Test
	public void testReduction() {
		PSL2ZReduction.Result r = PSL2ZReduction.reduce(0.2, 0.5);
		assertEquals(new SL2ZElement(1, -1, 1, 0), r.map);
		assertEquals(0.3103448275862069, r.x, 1e-12);
		assertEquals(1.7241379310344829, r.y, 1e-12);
	}

	@Test
	public void testResultLiesInStandardDomain() {
		double[][] points = { { 0.2, 0.5 }, { -3.7, 0.01 }, { 12.34, 0.001 }, { 0.49, 0.9 }, { 0.0, 2.0 } };
		for (double[] p : points) {
			PSL2ZReduction.Result r = PSL2ZReduction.reduce(p[0], p[1]);
			assertTrue(Math.abs(r.x) <= 0.5 + 1e-12);
			assertTrue(r.x * r.x + r.y * r.y >= 1 - 1e-12);
			Complex_F64 w = r.map.apply(new Complex_F64(p[0], p[1]));
			assertEquals(r.x, w.real, 1e-9);
			assertEquals(r.y, w.imaginary, 1e-9);
		}
	}

	@Test
	public void testPreciseReductionAgrees() {
		MathContext mc = new MathContext(60);
		PSL2ZReduction.PreciseResult r = PSL2ZReduction.reduce(new BigDecimal("-3.7"), new BigDecimal("0.01"), mc);
		PSL2ZReduction.Result d = PSL2ZReduction.reduce(-3.7, 0.01);
		assertEquals(d.map, r.map);
		assertEquals(d.x, r.x.doubleValue(), 1e-12);
		assertEquals(d.y, r.y.doubleValue(), 1e-12);
	}

	@Test
	public void testLowerHalfPlaneRejected() {
		assertThrows(IllegalArgumentException.class, () -> PSL2ZReduction.reduce(0.0, -1.0));
		assertThrows(IllegalArgumentException.class, () -> PSL2ZReduction.reduce(0.0, 0.0));
	}
}
