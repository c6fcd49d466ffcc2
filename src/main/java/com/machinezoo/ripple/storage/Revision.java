// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/**
 * Confirmed {@link Fact} together with the remote sequence number at which it was accepted.
 * Heap and Cache store revisions. Updates with lower or equal {@code since} are stale.
 */
public final class Revision {
	private final Fact fact;
	public Fact fact() {
		return fact;
	}
	private final long since;
	public long since() {
		return since;
	}
	public Revision(Fact fact, long since) {
		Objects.requireNonNull(fact);
		this.fact = fact;
		this.since = since;
	}
	public boolean newerThan(Revision other) {
		return other == null || since > other.since;
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Revision))
			return false;
		Revision other = (Revision)obj;
		return fact.equals(other.fact) && since == other.since;
	}
	@Override
	public int hashCode() {
		return 31 * fact.hashCode() + Long.hashCode(since);
	}
	@Override
	public String toString() {
		return fact + " since " + since;
	}
}
