// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.ripple.storage.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Actions are represented by integer handles assigned by the scheduler. All graph tables are keyed by handle,
 * so that unsubscription is a matter of removing a few map entries.
 *
 * Forward table holds the last reactivity log of every action. Reverse tables map entities to handles
 * of actions that read them and of actions that might write them. Dependency edges are derived from these:
 * action A feeds action B when some address A might write overlaps some address B reads.
 *
 * Might-write set accumulates writes over all runs of an action. A run that skipped a write
 * does not make the edge disappear, because the next run may write again.
 */
/**
 * Dependency graph of actions derived from their reactivity logs.
 */
@DraftDocs("describe edge derivation")
class DependencyTracker {
	private static final Logger logger = LoggerFactory.getLogger(DependencyTracker.class);
	private final Int2ObjectMap<ReactivityLog> forward = new Int2ObjectOpenHashMap<>();
	private final Int2ObjectMap<Set<Address>> mightWrite = new Int2ObjectOpenHashMap<>();
	private final Map<EntityKey, IntSet> readers = new HashMap<>();
	private final Map<EntityKey, IntSet> writers = new HashMap<>();
	private final Int2ObjectMap<IntSet> dependents = new Int2ObjectOpenHashMap<>();
	private final Int2ObjectMap<IntSet> providers = new Int2ObjectOpenHashMap<>();
	/**
	 * Runs the action once and returns the log of what it touched.
	 * Exceptions from the action propagate. The transaction still holds the partial log in that case.
	 *
	 * @param action
	 *            action to run
	 * @param transaction
	 *            transaction recording reads and writes
	 * @return reactivity log of this execution
	 */
	public ReactivityLog capture(Action action, Transaction transaction) {
		Objects.requireNonNull(action);
		Objects.requireNonNull(transaction);
		action.run(transaction);
		return transaction.log();
	}
	public boolean contains(int id) {
		return forward.containsKey(id);
	}
	public ReactivityLog log(int id) {
		return forward.getOrDefault(id, ReactivityLog.empty());
	}
	public Set<Address> mightWrite(int id) {
		Set<Address> writes = mightWrite.get(id);
		return writes != null ? Collections.unmodifiableSet(writes) : Collections.emptySet();
	}
	private static IntSet view(IntSet set) {
		return set != null ? IntSets.unmodifiable(set) : IntSets.EMPTY_SET;
	}
	public IntSet dependents(int id) {
		return view(dependents.get(id));
	}
	public IntSet providers(int id) {
		return view(providers.get(id));
	}
	public IntSet readers(EntityKey key) {
		return view(readers.get(key));
	}
	private static void index(Map<EntityKey, IntSet> table, EntityKey key, int id) {
		table.computeIfAbsent(key, k -> new IntOpenHashSet()).add(id);
	}
	private static void unindex(Map<EntityKey, IntSet> table, EntityKey key, int id) {
		IntSet ids = table.get(key);
		if (ids != null) {
			ids.remove(id);
			if (ids.isEmpty())
				table.remove(key);
		}
	}
	private void link(int provider, int dependent) {
		if (provider == dependent)
			return;
		dependents.computeIfAbsent(provider, k -> new IntOpenHashSet()).add(dependent);
		providers.computeIfAbsent(dependent, k -> new IntOpenHashSet()).add(provider);
	}
	private void unlink(int provider, int dependent) {
		IntSet set = dependents.get(provider);
		if (set != null && set.remove(dependent) && set.isEmpty())
			dependents.remove(provider);
		set = providers.get(dependent);
		if (set != null && set.remove(provider) && set.isEmpty())
			providers.remove(dependent);
	}
	private boolean writes(int id, Address read) {
		Set<Address> writes = mightWrite.get(id);
		if (writes == null)
			return false;
		for (Address write : writes)
			if (write.overlaps(read))
				return true;
		return false;
	}
	/**
	 * Checks whether the first action might write something the second action reads.
	 *
	 * @param provider
	 *            handle of the potential writer
	 * @param dependent
	 *            handle of the potential reader
	 * @return {@code true} if there is a dependency edge
	 */
	public boolean feeds(int provider, int dependent) {
		IntSet set = dependents.get(provider);
		return set != null && set.contains(dependent);
	}
	/**
	 * Replaces the log of an action and rebuilds its dependency edges.
	 *
	 * @param id
	 *            action handle
	 * @param log
	 *            log from the latest execution
	 */
	public void subscribe(int id, ReactivityLog log) {
		Objects.requireNonNull(log);
		ReactivityLog previous = forward.put(id, log);
		if (previous != null)
			for (Address read : previous.reads())
				unindex(readers, read.key(), id);
		for (Address read : log.reads())
			index(readers, read.key(), id);
		Set<Address> writes = mightWrite.computeIfAbsent(id, k -> new LinkedHashSet<>());
		writes.addAll(log.writes());
		for (Address write : writes)
			index(writers, write.key(), id);
		/*
		 * Reads may have changed completely, so incoming edges are rebuilt from scratch.
		 */
		for (int provider : new IntArrayList(providers(id)))
			unlink(provider, id);
		for (Address read : log.reads())
			for (int writer : writers.getOrDefault(read.key(), IntSets.EMPTY_SET))
				if (writes(writer, read))
					link(writer, id);
		/*
		 * Might-write set only grows, so outgoing edges are only added.
		 */
		for (Address write : writes)
			for (int reader : readers.getOrDefault(write.key(), IntSets.EMPTY_SET))
				if (log(reader).reads(write))
					link(id, reader);
		logger.trace("Action {} now has {} providers and {} dependents.", id, providers(id).size(), dependents(id).size());
	}
	/**
	 * Removes every trace of the action from the graph.
	 *
	 * @param id
	 *            action handle
	 */
	public void unsubscribe(int id) {
		ReactivityLog log = forward.remove(id);
		if (log != null)
			for (Address read : log.reads())
				unindex(readers, read.key(), id);
		Set<Address> writes = mightWrite.remove(id);
		if (writes != null)
			for (Address write : writes)
				unindex(writers, write.key(), id);
		for (int provider : new IntArrayList(providers(id)))
			unlink(provider, id);
		for (int dependent : new IntArrayList(dependents(id)))
			unlink(id, dependent);
	}
}
