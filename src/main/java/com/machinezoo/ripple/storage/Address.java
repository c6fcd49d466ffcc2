// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import com.google.common.collect.*;

/**
 * Addressable unit of state: a path of property steps inside the value of one entity in one space.
 * Addresses are immutable values and they are the unit of dependency tracking.
 * <p>
 * Path steps are strings. List elements are addressed by their decimal index.
 * Empty path refers to the whole entity value.
 *
 * @see ReactivityLog
 * @see ValuePaths
 */
public final class Address {
	private final EntityKey key;
	/**
	 * Space and entity this address points into.
	 *
	 * @return entity key of this address
	 */
	public EntityKey key() {
		return key;
	}
	public String space() {
		return key.space();
	}
	public String entity() {
		return key.entity();
	}
	private final ImmutableList<String> path;
	public List<String> path() {
		return path;
	}
	public Address(EntityKey key, List<String> path) {
		Objects.requireNonNull(key);
		this.key = key;
		this.path = ImmutableList.copyOf(path);
	}
	public Address(String space, String entity, List<String> path) {
		this(new EntityKey(space, entity), path);
	}
	public static Address of(String space, String entity, String... path) {
		return new Address(space, entity, Arrays.asList(path));
	}
	public Address child(String step) {
		Objects.requireNonNull(step);
		return new Address(key, ImmutableList.<String>builder().addAll(path).add(step).build());
	}
	/*
	 * Two addresses overlap when they point into the same entity and one path is a prefix of the other.
	 * Writing to an address therefore affects reads of all its ancestors and descendants.
	 */
	/**
	 * Checks whether changes to one of the addresses can affect the value at the other address.
	 *
	 * @param other
	 *            address to compare with
	 * @return {@code true} if both addresses point into the same entity and either path is a prefix of the other
	 */
	public boolean overlaps(Address other) {
		Objects.requireNonNull(other);
		if (!key.equals(other.key))
			return false;
		int common = Math.min(path.size(), other.path.size());
		for (int i = 0; i < common; ++i)
			if (!path.get(i).equals(other.path.get(i)))
				return false;
		return true;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Address))
			return false;
		Address other = (Address)obj;
		return key.equals(other.key) && path.equals(other.path);
	}
	@Override
	public int hashCode() {
		return 31 * key.hashCode() + path.hashCode();
	}
	@Override
	public String toString() {
		if (path.isEmpty())
			return key.toString();
		return key + "/" + String.join("/", path);
	}
}
