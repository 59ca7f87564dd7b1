package com.github.micycle1.modsub.sl2z;

/**
 * Thrown when a continued-fraction expansion does not terminate within its
 * bound, or when an S/T word fails to reproduce the matrix it was computed
 * from.
 */
public class FactorizationException extends ArithmeticException {

	private static final long serialVersionUID = 1L;

	public FactorizationException(String message) {
		super(message);
	}
}
