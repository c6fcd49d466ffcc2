// Part of Ripple
package com.machinezoo.ripple.storage;

/**
 * Cross-session persistent tier.
 * Cache is written only by write-through from the heap and read only on first access to an entity.
 *
 * @see MemoryFactCache
 */
public interface FactCache {
	/**
	 * Looks up cached revision.
	 *
	 * @param key
	 *            entity key
	 * @return cached revision or {@code null}
	 */
	Revision get(EntityKey key);
	void put(EntityKey key, Revision revision);
	void clear();
}
