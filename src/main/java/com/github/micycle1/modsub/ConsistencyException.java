package com.github.micycle1.modsub;

/**
 * Thrown when derived group data contradicts itself: a non-integral genus, a
 * stabilizer outside the group, or coset data disagreeing with the supplied
 * permutations.
 */
public class ConsistencyException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public ConsistencyException(String message) {
		super(message);
	}
}
