// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.stagean.*;

/*
 * Transaction records every address it reads or writes, which is where reactivity logs come from.
 * The first touch of an entity captures its visible fact as the base. Later reads of the same entity
 * see the same base overlaid with the transaction's own buffered writes, so the transaction
 * observes a consistent snapshot of every entity it touches.
 *
 * Writes are buffered until commit(). Base facts become the expected causes of the CAS check.
 * A transaction may write to only one space, because the remote store commits atomically per space.
 */
/**
 * Read/write capability given to one execution of an action.
 */
@DraftDocs("explain snapshot semantics in public docs")
public class Transaction {
	private final TierManager tiers;
	private final Map<EntityKey, Fact> bases = new HashMap<>();
	private final Map<EntityKey, Object> changes = new LinkedHashMap<>();
	private final Set<Address> reads = new LinkedHashSet<>();
	private final Set<Address> writes = new LinkedHashSet<>();
	private String space;
	private boolean open = true;
	Transaction(TierManager tiers) {
		Objects.requireNonNull(tiers);
		this.tiers = tiers;
	}
	public boolean open() {
		return open;
	}
	/**
	 * Space this transaction writes to.
	 *
	 * @return written space or {@code null} if nothing was written yet
	 */
	public String space() {
		return space;
	}
	private void ensureOpen() {
		if (!open)
			throw new IllegalStateException("Transaction was already committed or aborted.");
	}
	Fact base(EntityKey key) {
		if (!bases.containsKey(key))
			bases.put(key, tiers.fact(key));
		return bases.get(key);
	}
	private Object value(EntityKey key) {
		if (changes.containsKey(key))
			return changes.get(key);
		Fact base = base(key);
		return base != null ? base.value() : null;
	}
	Map<EntityKey, Object> changes() {
		return changes;
	}
	/**
	 * Reads value at an address and records the read.
	 * Entities that are not available locally read as {@code null} and their remote fetch is started.
	 *
	 * @param address
	 *            address to read
	 * @return current value or {@code null}
	 */
	public Object read(Address address) {
		Objects.requireNonNull(address);
		ensureOpen();
		reads.add(address);
		return ValuePaths.get(value(address.key()), address.path());
	}
	public void write(Address address, Object value) {
		Objects.requireNonNull(address);
		ensureOpen();
		if (space == null)
			space = address.space();
		else if (!space.equals(address.space()))
			throw new IllegalStateException("Transaction cannot write to both " + space + " and " + address.space() + ".");
		Object updated = ValuePaths.set(value(address.key()), address.path(), value);
		writes.add(address);
		changes.put(address.key(), updated);
	}
	public ReactivityLog log() {
		return new ReactivityLog(reads, writes);
	}
	/**
	 * Applies buffered writes to the tiers. Either all writes are accepted or the whole transaction is rejected.
	 *
	 * @return future completed once the remote store confirmed or rejected the commit
	 */
	public CompletableFuture<CommitResult> commit() {
		ensureOpen();
		open = false;
		return tiers.commit(this);
	}
	public void abort() {
		open = false;
		changes.clear();
	}
	@Override
	public String toString() {
		return "transaction: " + log();
	}
}
