package com.github.micycle1.modsub;

import java.util.Collections;
import java.util.List;

import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * Thrown when a full system of coset representatives could not be produced.
 * Carries the representatives found so far.
 */
public class CosetEnumerationException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final transient List<SL2ZElement> partial;

	public CosetEnumerationException(String message, List<SL2ZElement> partial) {
		super(message + " (" + partial.size() + " representatives found)");
		this.partial = Collections.unmodifiableList(partial);
	}

	public List<SL2ZElement> getPartialRepresentatives() {
		return partial;
	}
}
