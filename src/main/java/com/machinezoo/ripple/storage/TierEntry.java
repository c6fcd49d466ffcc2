// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/**
 * Snapshot of what each tier knows about one entity.
 * Returned by {@link TierManager#entry(EntityKey)} for diagnostics and tests.
 */
public final class TierEntry {
	private final EntityKey key;
	public EntityKey key() {
		return key;
	}
	private final Fact nursery;
	public Fact nursery() {
		return nursery;
	}
	private final Revision heap;
	public Revision heap() {
		return heap;
	}
	private final Revision cache;
	public Revision cache() {
		return cache;
	}
	TierEntry(EntityKey key, Fact nursery, Revision heap, Revision cache) {
		Objects.requireNonNull(key);
		this.key = key;
		this.nursery = nursery;
		this.heap = heap;
		this.cache = cache;
	}
	/**
	 * Tier the visible fact comes from.
	 *
	 * @return highest priority tier holding a fact or {@code null} if no tier knows the entity
	 */
	public Tier tier() {
		if (nursery != null)
			return Tier.NURSERY;
		if (heap != null)
			return Tier.HEAP;
		if (cache != null)
			return Tier.CACHE;
		return null;
	}
	public Fact visible() {
		if (nursery != null)
			return nursery;
		if (heap != null)
			return heap.fact();
		if (cache != null)
			return cache.fact();
		return null;
	}
	@Override
	public String toString() {
		return key + " in " + tier();
	}
}
