package com.github.micycle1.modsub;

import java.util.Collections;
import java.util.List;

import com.github.micycle1.modsub.sl2z.Cusp;
import com.github.micycle1.modsub.sl2z.SL2ZElement;

/**
 * A vertex {@code V_j(∞)} of the fundamental domain.
 */
public final class Vertex {

	public final int index;
	public final Cusp value;
	/** Cosets j with {@code V_j(∞)} equal to this vertex. */
	public final List<Integer> cosets;
	public final int cuspIndex;
	/** Group element sending the vertex to its cusp's canonical value. */
	public final SL2ZElement cuspMap;
	public final int width;

	Vertex(int index, Cusp value, List<Integer> cosets, int cuspIndex, SL2ZElement cuspMap, int width) {
		this.index = index;
		this.value = value;
		this.cosets = Collections.unmodifiableList(cosets);
		this.cuspIndex = cuspIndex;
		this.cuspMap = cuspMap;
		this.width = width;
	}

	@Override
	public String toString() {
		return "Vertex[" + index + ": " + value + " -> cusp " + cuspIndex + ", width " + width + "]";
	}
}
