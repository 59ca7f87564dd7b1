package com.github.micycle1.modsub;

/**
 * Thrown when no coset representative brings a reduced point back into the
 * group.
 */
public class PullbackException extends ArithmeticException {

	private static final long serialVersionUID = 1L;

	public PullbackException(String message) {
		super(message);
	}
}
