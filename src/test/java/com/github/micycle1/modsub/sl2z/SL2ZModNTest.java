package com.github.micycle1.modsub.sl2z;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

public class SL2ZModNTest {

	@Test
	public void testGroupOrders() {
		assertEquals(6, SL2ZModN.sl2Order(2));
		assertEquals(24, SL2ZModN.sl2Order(3));
		assertEquals(48, SL2ZModN.sl2Order(4));
		assertEquals(120, SL2ZModN.sl2Order(5));
		assertEquals(144, SL2ZModN.sl2Order(6));
	}

	@Test
	public void testGamma0Index() {
		assertEquals(1, SL2ZModN.gamma0Index(1));
		assertEquals(6, SL2ZModN.gamma0Index(4));
		assertEquals(12, SL2ZModN.gamma0Index(6));
		assertEquals(12, SL2ZModN.gamma0Index(11));
		assertEquals(24, SL2ZModN.gamma0Index(12));
	}

	@Test
	public void testUnits() {
		assertArrayEquals(new int[] { 1, 5, 7, 11 }, SL2ZModN.units(12));
		assertArrayEquals(new int[] { 1 }, SL2ZModN.units(2));
	}

	@Test
	public void testProjectiveKeys() {
		int[] units = SL2ZModN.units(5);
		assertEquals(SL2ZModN.projectiveKey(1, 2, 5, units), SL2ZModN.projectiveKey(3, 6, 5, units));
		assertEquals(SL2ZModN.projectiveKey(-1, 1, 5, units), SL2ZModN.projectiveKey(1, -1, 5, units));
		assertNotEquals(SL2ZModN.projectiveKey(1, 2, 5, units), SL2ZModN.projectiveKey(1, 3, 5, units));
	}

	@Test
	public void testClosureOfGenerators() {
		List<SL2ZElement> gens = List.of(SL2ZElement.S, SL2ZElement.T);
		assertEquals(120, SL2ZModN.closureOrder(gens, 5, Long.MAX_VALUE));
		assertEquals(-1, SL2ZModN.closureOrder(gens, 5, 100));
		// upper triangular matrices with unit diagonal mod 5
		assertEquals(5, SL2ZModN.closureOrder(List.of(SL2ZElement.T), 5, Long.MAX_VALUE));
	}
}
