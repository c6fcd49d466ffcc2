// Part of Ripple
package com.machinezoo.ripple.storage;

/**
 * Storage tier holding a fact, listed in read priority order.
 */
public enum Tier {
	/**
	 * Local writes not yet confirmed by the remote store.
	 */
	NURSERY,
	/**
	 * Confirmed state of the current session.
	 */
	HEAP,
	/**
	 * Persistent state shared across sessions.
	 */
	CACHE
}
