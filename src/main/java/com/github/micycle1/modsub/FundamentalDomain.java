package com.github.micycle1.modsub;

import java.util.Collections;
import java.util.List;

/**
 * Vertices, inequivalent cusps and signature of a subgroup. Vertex 0 and cusp
 * 0 are infinity; vertex 1 and cusp 1 are 0 when present.
 */
public final class FundamentalDomain {

	private final List<Vertex> vertices;
	private final List<CuspData> cusps;
	private final Signature signature;

	FundamentalDomain(List<Vertex> vertices, List<CuspData> cusps, Signature signature) {
		this.vertices = Collections.unmodifiableList(vertices);
		this.cusps = Collections.unmodifiableList(cusps);
		this.signature = signature;
	}

	public List<Vertex> getVertices() {
		return vertices;
	}

	public List<CuspData> getCusps() {
		return cusps;
	}

	public Signature getSignature() {
		return signature;
	}
}
