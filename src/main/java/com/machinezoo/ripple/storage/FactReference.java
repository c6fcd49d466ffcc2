// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/**
 * Content hash identifying one {@link Fact}.
 * Facts link to their predecessor through {@code FactReference}, forming a hash-linked history per entity.
 */
public final class FactReference {
	private final String hash;
	public String hash() {
		return hash;
	}
	public FactReference(String hash) {
		Objects.requireNonNull(hash);
		if (hash.isEmpty())
			throw new IllegalArgumentException("Fact reference cannot be empty.");
		this.hash = hash;
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof FactReference && hash.equals(((FactReference)obj).hash);
	}
	@Override
	public int hashCode() {
		return hash.hashCode();
	}
	@Override
	public String toString() {
		return hash.length() > 12 ? hash.substring(0, 12) : hash;
	}
}
