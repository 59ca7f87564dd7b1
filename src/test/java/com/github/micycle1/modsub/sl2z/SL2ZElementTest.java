package com.github.micycle1.modsub.sl2z;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import org.ejml.data.Complex_F64;
import org.junit.jupiter.api.Test;

public class SL2ZElementTest {

	@Test
	public void testDeterminantIsChecked() {
		assertThrows(IllegalArgumentException.class, () -> new SL2ZElement(1, 1, 1, 1));
		assertThrows(IllegalArgumentException.class, () -> new SL2ZElement(2, 0, 0, 1));
	}

	@Test
	public void testGeneratorRelations() {
		assertEquals(SL2ZElement.MINUS_IDENTITY, SL2ZElement.S.pow(2));
		assertEquals(SL2ZElement.R, SL2ZElement.S.multiply(SL2ZElement.T));
		assertEquals(SL2ZElement.MINUS_IDENTITY, SL2ZElement.R.pow(3));
		assertEquals(SL2ZElement.T_INV, SL2ZElement.T.inverse());
		assertEquals(SL2ZElement.translation(5), SL2ZElement.T.pow(5));
		assertEquals(SL2ZElement.translation(-3), SL2ZElement.T.pow(-3));
	}

	@Test
	public void testInverse() {
		SL2ZElement m = new SL2ZElement(13, 8, 8, 5);
		assertEquals(SL2ZElement.IDENTITY, m.multiply(m.inverse()));
		assertEquals(SL2ZElement.IDENTITY, m.inverse().multiply(m));
	}

	@Test
	public void testActionOnCusps() {
		assertEquals(Cusp.ZERO, SL2ZElement.S.apply(Cusp.INFINITY));
		assertEquals(Cusp.INFINITY, SL2ZElement.S.apply(Cusp.ZERO));
		assertEquals(Cusp.of(1, 2), new SL2ZElement(1, 0, 2, 1).apply(Cusp.INFINITY));
		assertEquals(Cusp.of(-1, 2), new SL2ZElement(-1, 0, 2, -1).apply(Cusp.INFINITY));
		assertEquals(Cusp.of(3, 2), SL2ZElement.T.apply(Cusp.of(1, 2)));
	}

	@Test
	public void testActionOnUpperHalfPlane() {
		Complex_F64 i = new Complex_F64(0, 1);
		Complex_F64 si = SL2ZElement.S.apply(i);
		assertEquals(0, si.real, 1e-15);
		assertEquals(1, si.imaginary, 1e-15);
		Complex_F64 tz = SL2ZElement.T.apply(new Complex_F64(0.5, 1));
		assertEquals(1.5, tz.real, 1e-15);
		assertEquals(1.0, tz.imaginary, 1e-15);

		SL2ZElement m = new SL2ZElement(2, 1, 1, 1);
		Complex_F64 w = m.apply(new Complex_F64(0.25, 0.75));
		BigDecimal[] wp = m.apply(new BigDecimal("0.25"), new BigDecimal("0.75"), MathContext.DECIMAL128);
		assertEquals(w.real, wp[0].doubleValue(), 1e-14);
		assertEquals(w.imaginary, wp[1].doubleValue(), 1e-14);
	}

	@Test
	public void testLift() {
		for (Cusp c : new Cusp[] { Cusp.ZERO, Cusp.INFINITY, Cusp.of(-3, 7), Cusp.of(5, 2), Cusp.of(-1, 2) }) {
			assertEquals(c, SL2ZElement.lift(c).apply(Cusp.INFINITY));
		}
		assertEquals(SL2ZElement.S, SL2ZElement.lift(Cusp.ZERO));
	}

	@Test
	public void testSignNormalization() {
		SL2ZElement m = new SL2ZElement(1, 0, -4, 1);
		assertEquals(new SL2ZElement(-1, 0, 4, -1), m.normalizedSign());
		assertEquals(SL2ZElement.IDENTITY, SL2ZElement.MINUS_IDENTITY.normalizedSign());
		assertTrue(m.equalsUpToSign(m.negate()));
		assertTrue(SL2ZElement.MINUS_IDENTITY.isIdentityUpToSign());
	}

	@Test
	public void testEntriesGrowPastLongRange() {
		SL2ZElement big = SL2ZElement.translation(Long.MAX_VALUE).multiply(SL2ZElement.T);
		assertEquals(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE), big.b);
		SL2ZElement m = new SL2ZElement(13, 8, 8, 5).pow(40);
		assertTrue(m.maxAbsEntry().bitLength() > 64);
		assertEquals(SL2ZElement.IDENTITY, m.multiply(m.inverse()));
		assertEquals(new SL2ZElement(13, 8, 8, 5).pow(-40), m.inverse());
		// cusps are machine-size fractions
		assertThrows(ArithmeticException.class, () -> m.apply(Cusp.INFINITY));
	}
}
