// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/**
 * Tier of confirmed state of the current session.
 * Heap also remembers entities known to be absent in the remote store, so that they are not fetched repeatedly.
 */
public class Heap {
	private final Map<EntityKey, Revision> revisions = new HashMap<>();
	private final Set<EntityKey> missing = new HashSet<>();
	public Revision get(EntityKey key) {
		return revisions.get(key);
	}
	public boolean contains(EntityKey key) {
		return revisions.containsKey(key) || missing.contains(key);
	}
	/**
	 * Stores the revision unless the heap already holds the same or newer one.
	 *
	 * @param key
	 *            entity key
	 * @param revision
	 *            confirmed revision
	 * @return {@code true} if the heap was updated
	 */
	public boolean merge(EntityKey key, Revision revision) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(revision);
		if (!revision.newerThan(revisions.get(key)))
			return false;
		revisions.put(key, revision);
		missing.remove(key);
		return true;
	}
	public void markMissing(EntityKey key) {
		if (!revisions.containsKey(key))
			missing.add(key);
	}
	public int size() {
		return revisions.size();
	}
	public void clear() {
		revisions.clear();
		missing.clear();
	}
}
