// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import com.google.common.collect.*;

/*
 * The log is an exact account of one execution. Duplicates are dropped, but addresses are not merged by prefix,
 * so that the log lists precisely what the action touched and nothing more.
 */
/**
 * Addresses read and written during one execution of an action.
 * {@code ReactivityLog} is immutable.
 */
public final class ReactivityLog {
	private static final ReactivityLog empty = new ReactivityLog(Collections.emptyList(), Collections.emptyList());
	public static ReactivityLog empty() {
		return empty;
	}
	private final ImmutableList<Address> reads;
	public List<Address> reads() {
		return reads;
	}
	private final ImmutableList<Address> writes;
	public List<Address> writes() {
		return writes;
	}
	public ReactivityLog(Collection<Address> reads, Collection<Address> writes) {
		this.reads = ImmutableSet.copyOf(reads).asList();
		this.writes = ImmutableSet.copyOf(writes).asList();
	}
	public boolean isEmpty() {
		return reads.isEmpty() && writes.isEmpty();
	}
	/**
	 * Checks whether any read in this log overlaps the given address.
	 *
	 * @param address
	 *            address to test
	 * @return {@code true} if the address overlaps at least one read
	 */
	public boolean reads(Address address) {
		for (Address read : reads)
			if (read.overlaps(address))
				return true;
		return false;
	}
	public Set<EntityKey> entities() {
		Set<EntityKey> entities = new LinkedHashSet<>();
		for (Address read : reads)
			entities.add(read.key());
		for (Address write : writes)
			entities.add(write.key());
		return entities;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ReactivityLog))
			return false;
		ReactivityLog other = (ReactivityLog)obj;
		return reads.equals(other.reads) && writes.equals(other.writes);
	}
	@Override
	public int hashCode() {
		return Objects.hash(reads, writes);
	}
	@Override
	public String toString() {
		return "reads " + reads + ", writes " + writes;
	}
}
