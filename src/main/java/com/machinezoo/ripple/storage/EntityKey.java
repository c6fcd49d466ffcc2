// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/**
 * Identity of one entity within one space.
 * Tiers, pending commits, and the reverse dependency index are all keyed by {@code EntityKey}.
 */
public final class EntityKey {
	private final String space;
	public String space() {
		return space;
	}
	private final String entity;
	public String entity() {
		return entity;
	}
	public EntityKey(String space, String entity) {
		Objects.requireNonNull(space);
		Objects.requireNonNull(entity);
		this.space = space;
		this.entity = entity;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof EntityKey))
			return false;
		EntityKey other = (EntityKey)obj;
		return space.equals(other.space) && entity.equals(other.entity);
	}
	@Override
	public int hashCode() {
		return 31 * space.hashCode() + entity.hashCode();
	}
	@Override
	public String toString() {
		return space + "/" + entity;
	}
}
