package com.github.micycle1.modsub.perm;

/**
 * Thrown when permutation data is malformed: not a bijection of {1..n},
 * mismatched lengths, or unparsable cycle notation.
 */
public class PermutationFormatException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public PermutationFormatException(String message) {
		super(message);
	}

	public PermutationFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
