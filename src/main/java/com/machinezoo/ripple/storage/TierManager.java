// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.google.common.collect.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.ripple.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Tier manager reconciles optimistic local writes with the remote authority.
 * Reads are shadowed in the order nursery, heap, cache, and a miss starts a remote fetch.
 *
 * Tier manager is confined to its executor, which is the run-loop of the scheduler using it.
 * Remote futures and subscription callbacks are posted to the executor before they touch any tier.
 * Callers outside the run-loop must go through the executor as well. Public methods fail fast when they are not.
 *
 * Listeners hear about every change of a visible entity value. Operations that do not change
 * what readers see, for example promotion of a confirmed fact from nursery to heap, produce no notification.
 */
/**
 * Three-tier storage of entity facts with CAS commits against a {@link RemoteStore}.
 */
@DraftDocs("document eviction rules in public docs")
public class TierManager {
	private static final Logger logger = LoggerFactory.getLogger(TierManager.class);
	private static final Counter commitCounter = Metrics.counter("ripple.storage.commits");
	private static final Counter conflictCounter = Metrics.counter("ripple.storage.conflicts");
	private final RemoteStore remote;
	private final FactCache cache;
	private final Executor executor;
	private final Nursery nursery = new Nursery();
	private final Heap heap = new Heap();
	/*
	 * Local facts sent to the remote store and not yet confirmed or rejected.
	 * Remote updates that confirm one of these are recognized as our own writes.
	 */
	private final SetMultimap<EntityKey, FactReference> pending = HashMultimap.create();
	private final Map<EntityKey, CompletableFuture<Void>> loading = new HashMap<>();
	private final Set<EntityKey> subscribed = new HashSet<>();
	private final List<StorageListener> listeners = new CopyOnWriteArrayList<>();
	public TierManager(RemoteStore remote, FactCache cache, Executor executor) {
		Objects.requireNonNull(remote);
		Objects.requireNonNull(cache);
		Objects.requireNonNull(executor);
		this.remote = remote;
		this.cache = cache;
		this.executor = executor;
	}
	public Executor executor() {
		return executor;
	}
	private void confined() {
		RunLoopExecutor.confine(executor);
	}
	public void listen(StorageListener listener) {
		Objects.requireNonNull(listener);
		listeners.add(listener);
	}
	public void unlisten(StorageListener listener) {
		listeners.remove(listener);
	}
	private void notify(List<StorageChange> changes) {
		if (changes.isEmpty())
			return;
		for (StorageListener listener : listeners)
			ExceptionLogging.log(logger).run(() -> listener.changed(changes));
	}
	private static void diff(List<StorageChange> changes, EntityKey key, StorageChange.Kind kind, Object before, Object after) {
		if (!Objects.equals(before, after))
			changes.add(new StorageChange(key, kind, before, after));
	}
	private Fact visible(EntityKey key) {
		Fact held = nursery.get(key);
		if (held != null)
			return held;
		Revision confirmed = heap.get(key);
		return confirmed != null ? confirmed.fact() : null;
	}
	private Object visibleValue(EntityKey key) {
		Fact fact = visible(key);
		return fact != null ? fact.value() : null;
	}
	private static FactReference reference(Fact fact) {
		return fact != null ? fact.reference() : null;
	}
	/**
	 * Returns the visible fact of an entity, reading nursery, heap, and cache in this order.
	 * If no tier knows the entity, remote fetch is started and {@code null} is returned.
	 * Listeners are notified when the fetched fact arrives.
	 *
	 * @param key
	 *            entity to read
	 * @return visible fact or {@code null}
	 */
	public Fact fact(EntityKey key) {
		Objects.requireNonNull(key);
		confined();
		Fact fact = visible(key);
		if (fact != null || heap.contains(key))
			return fact;
		Revision cached = cache.get(key);
		if (cached != null) {
			heap.merge(key, cached);
			fetch(key);
			return cached.fact();
		}
		fetch(key);
		return null;
	}
	public Object get(Address address) {
		Objects.requireNonNull(address);
		Fact fact = fact(address.key());
		return ValuePaths.get(fact != null ? fact.value() : null, address.path());
	}
	public Transaction begin() {
		confined();
		return new Transaction(this);
	}
	/**
	 * Writes single value in its own transaction.
	 *
	 * @param address
	 *            address to write
	 * @param value
	 *            new value
	 * @return commit future
	 */
	public CompletableFuture<CommitResult> set(Address address, Object value) {
		Transaction transaction = begin();
		transaction.write(address, value);
		return transaction.commit();
	}
	public TierEntry entry(EntityKey key) {
		Objects.requireNonNull(key);
		confined();
		return new TierEntry(key, nursery.get(key), heap.get(key), cache.get(key));
	}
	public Set<FactReference> pending(EntityKey key) {
		confined();
		return ImmutableSet.copyOf(pending.get(key));
	}
	/**
	 * Makes the entity available locally.
	 *
	 * @param key
	 *            entity to load
	 * @return future completed when the entity is in the heap or known to be absent remotely
	 */
	public CompletableFuture<Void> load(EntityKey key) {
		Objects.requireNonNull(key);
		confined();
		if (nursery.get(key) != null || heap.contains(key))
			return CompletableFuture.completedFuture(null);
		Revision cached = cache.get(key);
		if (cached != null) {
			heap.merge(key, cached);
			fetch(key);
			return CompletableFuture.completedFuture(null);
		}
		return fetch(key);
	}
	public CompletableFuture<Void> load(String space, String entity) {
		return load(new EntityKey(space, entity));
	}
	private CompletableFuture<Void> fetch(EntityKey key) {
		CompletableFuture<Void> existing = loading.get(key);
		if (existing != null)
			return existing;
		CompletableFuture<Void> loaded = new CompletableFuture<>();
		loading.put(key, loaded);
		subscribe(key);
		logger.debug("Fetching {} from remote store.", key);
		remote.pull(key.space(), key.entity()).whenComplete((revision, exception) -> executor.execute(() -> {
			loading.remove(key);
			if (exception != null) {
				logger.warn("Failed to fetch {}.", key, exception);
				loaded.completeExceptionally(exception);
				return;
			}
			if (revision != null)
				merge(key, revision, StorageChange.Kind.LOAD);
			else
				heap.markMissing(key);
			loaded.complete(null);
		}));
		return loaded;
	}
	private void subscribe(EntityKey key) {
		if (subscribed.add(key))
			remote.subscribe(key.space(), key.entity(), revision -> executor.execute(() -> integrate(key, revision)));
	}
	/**
	 * Merges a remote update into the heap and cache, evicting nursery entries it makes obsolete.
	 *
	 * @param key
	 *            updated entity
	 * @param revision
	 *            confirmed revision from the remote store
	 */
	public void integrate(EntityKey key, Revision revision) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(revision);
		confined();
		merge(key, revision, StorageChange.Kind.INTEGRATE);
	}
	private void merge(EntityKey key, Revision revision, StorageChange.Kind kind) {
		Object before = visibleValue(key);
		if (!heap.merge(key, revision)) {
			logger.debug("Ignoring stale revision {} of {}.", revision, key);
			return;
		}
		cache.put(key, revision);
		Fact held = nursery.get(key);
		Fact incoming = revision.fact();
		if (held != null) {
			if (held.equals(incoming)) {
				// Remote store caught up with the local write.
				nursery.remove(key);
				pending.remove(key, incoming.reference());
			} else if (pending.containsEntry(key, incoming.reference()) || incoming.reference().equals(held.cause())) {
				// Local write in the nursery is built on top of the incoming fact.
				pending.remove(key, incoming.reference());
			} else {
				logger.debug("Remote update of {} conflicts with local write, purging nursery.", key);
				nursery.remove(key);
				pending.removeAll(key);
			}
		}
		List<StorageChange> changes = new ArrayList<>();
		diff(changes, key, kind, before, visibleValue(key));
		notify(changes);
	}
	/*
	 * The CAS check runs locally first against the visible fact, which includes the nursery.
	 * Local rejection completes the returned future immediately and leaves the tiers untouched.
	 * Accepted writes enter the nursery at once and are then confirmed or rejected by the remote store.
	 */
	/**
	 * Commits buffered writes of a transaction.
	 *
	 * @param transaction
	 *            transaction whose writes are committed
	 * @return future completed on the executor after the tiers reflect the outcome
	 */
	public CompletableFuture<CommitResult> commit(Transaction transaction) {
		Objects.requireNonNull(transaction);
		confined();
		Map<EntityKey, Object> changes = transaction.changes();
		if (changes.isEmpty())
			return CompletableFuture.completedFuture(CommitResult.success(Collections.emptyList()));
		for (EntityKey key : changes.keySet()) {
			FactReference expected = reference(transaction.base(key));
			FactReference actual = reference(visible(key));
			if (!Objects.equals(expected, actual)) {
				conflictCounter.increment();
				logger.info("Rejecting commit to {}: built on {}, current is {}.", key, expected, actual);
				return CompletableFuture.completedFuture(CommitResult.rejected(new CommitResult.Conflict(key, expected, heap.get(key))));
			}
		}
		/*
		 * All facts are built before the first of them enters the nursery, so that a failure here leaves the tiers untouched.
		 */
		Map<EntityKey, Fact> built = new LinkedHashMap<>();
		for (Map.Entry<EntityKey, Object> change : changes.entrySet()) {
			EntityKey key = change.getKey();
			Fact base = transaction.base(key);
			if (Objects.equals(base != null ? base.value() : null, change.getValue()))
				continue;
			built.put(key, base != null ? base.next(change.getValue()) : new Fact(key.entity(), change.getValue(), null));
		}
		if (built.isEmpty())
			return CompletableFuture.completedFuture(CommitResult.success(Collections.emptyList()));
		List<Fact> facts = new ArrayList<>();
		Map<String, FactReference> expected = new HashMap<>();
		List<StorageChange> notifications = new ArrayList<>();
		for (Map.Entry<EntityKey, Fact> entry : built.entrySet()) {
			EntityKey key = entry.getKey();
			Fact fact = entry.getValue();
			Fact base = transaction.base(key);
			nursery.put(key, fact);
			pending.put(key, fact.reference());
			facts.add(fact);
			expected.put(key.entity(), reference(base));
			subscribe(key);
			diff(notifications, key, StorageChange.Kind.COMMIT, base != null ? base.value() : null, fact.value());
		}
		commitCounter.increment();
		String space = transaction.space();
		logger.debug("Committing {} facts to space {}.", facts.size(), space);
		notify(notifications);
		CompletableFuture<CommitResult> settled = new CompletableFuture<>();
		remote.commit(space, facts, expected).whenComplete((result, exception) -> executor.execute(() -> {
			settle(space, facts, result, exception);
			if (exception != null)
				settled.completeExceptionally(exception);
			else
				settled.complete(result);
		}));
		return settled;
	}
	private void settle(String space, List<Fact> facts, CommitResult result, Throwable exception) {
		Map<EntityKey, Object> before = new LinkedHashMap<>();
		for (Fact fact : facts) {
			EntityKey key = new EntityKey(space, fact.entity());
			before.put(key, visibleValue(key));
		}
		List<StorageChange> changes = new ArrayList<>();
		if (exception == null && result.ok()) {
			for (Revision revision : result.revisions()) {
				EntityKey key = new EntityKey(space, revision.fact().entity());
				pending.remove(key, revision.fact().reference());
				if (heap.merge(key, revision))
					cache.put(key, revision);
				nursery.evict(key, revision.fact());
			}
			for (Map.Entry<EntityKey, Object> entry : before.entrySet())
				diff(changes, entry.getKey(), StorageChange.Kind.INTEGRATE, entry.getValue(), visibleValue(entry.getKey()));
		} else {
			conflictCounter.increment();
			if (exception != null)
				logger.info("Commit to space {} failed, rolling back.", space, exception);
			else
				logger.info("Commit to space {} rejected, rolling back: {}", space, result.conflict());
			for (EntityKey key : before.keySet()) {
				nursery.remove(key);
				pending.removeAll(key);
			}
			if (result != null && result.conflict().actual() != null) {
				CommitResult.Conflict conflict = result.conflict();
				if (heap.merge(conflict.key(), conflict.actual()))
					cache.put(conflict.key(), conflict.actual());
			}
			for (Map.Entry<EntityKey, Object> entry : before.entrySet())
				diff(changes, entry.getKey(), StorageChange.Kind.REVERT, entry.getValue(), visibleValue(entry.getKey()));
		}
		notify(changes);
	}
	/**
	 * Drops nursery, heap, and pending commit tracking, for example after reconnection.
	 * Listeners, remote subscriptions, and the cache are kept.
	 */
	public void reset() {
		confined();
		logger.debug("Resetting storage tiers.");
		nursery.clear();
		heap.clear();
		pending.clear();
		loading.clear();
	}
}
