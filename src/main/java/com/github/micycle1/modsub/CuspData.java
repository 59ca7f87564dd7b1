package com.github.micycle1.modsub;

import java.util.Collections;
import java.util.List;

import com.github.micycle1.modsub.sl2z.Cusp;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * An inequivalent cusp: its canonical value, a normalizer {@code N} with
 * {@code N(∞) = value}, its width w and the stabilizer generator
 * {@code N·T^w·N⁻¹}.
 */
public final class CuspData {

	public final int index;
	public final Cusp value;
	public final SL2ZElement normalizer;
	public final int width;
	public final SL2ZElement stabilizer;
	/** The coset {@code 1·N}. */
	public final int cosetLabel;
	public final List<Integer> vertices;

	CuspData(int index, Cusp value, SL2ZElement normalizer, int width, SL2ZElement stabilizer, int cosetLabel,
			List<Integer> vertices) {
		this.index = index;
		this.value = value;
		this.normalizer = normalizer;
		this.width = width;
		this.stabilizer = stabilizer;
		this.cosetLabel = cosetLabel;
		this.vertices = Collections.unmodifiableList(vertices);
	}

	@Override
	public String toString() {
		return "Cusp[" + index + ": " + value + ", width " + width + ", normalizer " + normalizer + "]";
	}
}
