// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/**
 * Change of the visible value of one entity.
 */
public final class StorageChange {
	/**
	 * Cause of the change.
	 */
	public enum Kind {
		/**
		 * Local commit placed a new fact in the nursery.
		 */
		COMMIT,
		/**
		 * Rejected commit was rolled back to the confirmed value.
		 */
		REVERT,
		/**
		 * Remote update was merged into the heap.
		 */
		INTEGRATE,
		/**
		 * Entity was loaded from the remote store for the first time.
		 */
		LOAD
	}
	private final EntityKey key;
	public EntityKey key() {
		return key;
	}
	private final Kind kind;
	public Kind kind() {
		return kind;
	}
	private final Object before;
	public Object before() {
		return before;
	}
	private final Object after;
	public Object after() {
		return after;
	}
	public StorageChange(EntityKey key, Kind kind, Object before, Object after) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(kind);
		this.key = key;
		this.kind = kind;
		this.before = before;
		this.after = after;
	}
	/**
	 * Checks whether the value at the given address differs between the before and after state.
	 *
	 * @param address
	 *            address in the changed entity
	 * @return {@code true} if the address is in this entity and its value changed
	 */
	public boolean affects(Address address) {
		if (!key.equals(address.key()))
			return false;
		return !Objects.equals(ValuePaths.get(before, address.path()), ValuePaths.get(after, address.path()));
	}
	@Override
	public String toString() {
		return kind + " of " + key;
	}
}
