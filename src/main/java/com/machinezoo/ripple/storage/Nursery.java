// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/*
 * Nursery holds only locally originated facts that the remote store has not confirmed yet.
 * Data received from the remote store never enters the nursery. It only causes nursery entries to be evicted.
 */
/**
 * Tier of unconfirmed local writes.
 */
public class Nursery {
	private final Map<EntityKey, Fact> facts = new HashMap<>();
	public Fact get(EntityKey key) {
		return facts.get(key);
	}
	public void put(EntityKey key, Fact fact) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(fact);
		facts.put(key, fact);
	}
	public Fact remove(EntityKey key) {
		return facts.remove(key);
	}
	/**
	 * Removes the entry only if it still holds exactly the given fact.
	 * Newer local facts built on top of the given fact are left in place.
	 *
	 * @param key
	 *            entity key
	 * @param confirmed
	 *            fact that was confirmed or superseded remotely
	 * @return {@code true} if the entry was removed
	 */
	public boolean evict(EntityKey key, Fact confirmed) {
		Fact current = facts.get(key);
		if (current != null && current.equals(confirmed)) {
			facts.remove(key);
			return true;
		}
		return false;
	}
	public boolean isEmpty() {
		return facts.isEmpty();
	}
	public int size() {
		return facts.size();
	}
	public void clear() {
		facts.clear();
	}
}
