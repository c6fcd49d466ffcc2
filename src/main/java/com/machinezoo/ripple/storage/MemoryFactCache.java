// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;

/**
 * {@link FactCache} kept in memory with bounded size.
 */
@NoTests
public class MemoryFactCache implements FactCache {
	private final Cache<EntityKey, Revision> cache;
	public MemoryFactCache(long capacity) {
		if (capacity <= 0)
			throw new IllegalArgumentException("Cache capacity must be positive.");
		cache = CacheBuilder.newBuilder()
			.maximumSize(capacity)
			.build();
	}
	public MemoryFactCache() {
		this(10_000);
	}
	@Override
	public Revision get(EntityKey key) {
		return cache.getIfPresent(key);
	}
	/*
	 * Cache is write-through target of the heap, so it never goes back in time.
	 */
	@Override
	public void put(EntityKey key, Revision revision) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(revision);
		cache.asMap().merge(key, revision, (previous, next) -> next.newerThan(previous) ? next : previous);
	}
	@Override
	public void clear() {
		cache.invalidateAll();
	}
	public long size() {
		return cache.size();
	}
}
