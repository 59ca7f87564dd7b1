package com.github.micycle1.modsub.sl2z;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

public class STFactorizationTest {

	@Test
	public void testLowerTriangular() {
		SL2ZElement m = new SL2ZElement(1, 0, 2, 1);
		STFactorization f = STFactorization.of(m);
		assertEquals(-1, f.sign);
		assertEquals(BigInteger.ZERO, f.t0);
		assertArrayEquals(new BigInteger[] { BigInteger.valueOf(-2), BigInteger.ZERO }, f.exponents());
		assertEquals(m, f.toMatrix());
	}

	@Test
	public void testTranslations() {
		STFactorization f = STFactorization.of(SL2ZElement.translation(5));
		assertEquals(1, f.sign);
		assertEquals(BigInteger.valueOf(5), f.t0);
		assertEquals(0, f.length());

		STFactorization g = STFactorization.of(new SL2ZElement(-1, -3, 0, -1));
		assertEquals(-1, g.sign);
		assertEquals(BigInteger.valueOf(3), g.t0);
		assertEquals(new SL2ZElement(-1, -3, 0, -1), g.toMatrix());
	}

	@Test
	public void testInversion() {
		STFactorization f = STFactorization.of(SL2ZElement.S);
		assertEquals(SL2ZElement.S, f.toMatrix());
		assertEquals(1, f.length());
	}

	@Test
	public void testWordsReproduceMatrices() {
		SL2ZElement[] ms = { new SL2ZElement(13, 8, 8, 5), new SL2ZElement(-2, -1, 1, 0), new SL2ZElement(3, 1, -4, -1),
				new SL2ZElement(355, -22, 113, -7), new SL2ZElement(-7, 2, 31, -9), SL2ZElement.R.pow(2) };
		for (SL2ZElement m : ms) {
			STFactorization f = STFactorization.of(m);
			assertEquals(m, f.toMatrix(), f.toString());
		}
	}

	@Test
	public void testEntriesBeyondLongRange() {
		SL2ZElement big = SL2ZElement.translation(Long.MAX_VALUE).multiply(SL2ZElement.S)
				.multiply(SL2ZElement.translation(Long.MAX_VALUE)).multiply(SL2ZElement.S).multiply(SL2ZElement.T.pow(3));
		assertTrue(big.maxAbsEntry().bitLength() > 100);
		STFactorization f = STFactorization.of(big);
		assertEquals(big, f.toMatrix());
		assertEquals(BigInteger.valueOf(Long.MAX_VALUE), f.t0);
	}
}
