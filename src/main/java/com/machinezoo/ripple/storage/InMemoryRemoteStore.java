// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.common.collect.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;

/*
 * Reference implementation of the remote store that keeps everything in memory.
 * It serves local operation without a server and it is the remote store of choice in tests,
 * which is why it can hold back or reject commits on request.
 *
 * All state changes happen under the object lock. Subscribers are notified after the lock is released.
 */
/**
 * {@link RemoteStore} kept in memory with CAS per entity and per-space sequence numbers.
 */
@StubDocs
public class InMemoryRemoteStore implements RemoteStore {
	private static final Logger logger = LoggerFactory.getLogger(InMemoryRemoteStore.class);
	private final Map<EntityKey, Revision> entities = new HashMap<>();
	private final Map<String, Long> sequences = new HashMap<>();
	private final SetMultimap<EntityKey, Consumer<Revision>> subscribers = LinkedHashMultimap.create();
	@Override
	public synchronized CompletableFuture<Revision> pull(String space, String entity) {
		return CompletableFuture.completedFuture(entities.get(new EntityKey(space, entity)));
	}
	public synchronized Revision current(String space, String entity) {
		return entities.get(new EntityKey(space, entity));
	}
	@Override
	public synchronized void subscribe(String space, String entity, Consumer<Revision> listener) {
		Objects.requireNonNull(listener);
		subscribers.put(new EntityKey(space, entity), listener);
	}
	@Override
	public synchronized void unsubscribe(String space, String entity, Consumer<Revision> listener) {
		subscribers.remove(new EntityKey(space, entity), listener);
	}
	/*
	 * While paused, commits are queued and their futures stay incomplete.
	 * This simulates network latency between local write and remote confirmation.
	 */
	private boolean paused;
	private final List<Runnable> held = new ArrayList<>();
	public synchronized void pause() {
		paused = true;
	}
	public void resume() {
		List<Runnable> released;
		synchronized (this) {
			paused = false;
			released = new ArrayList<>(held);
			held.clear();
		}
		for (Runnable commit : released)
			commit.run();
	}
	private int rejections;
	/**
	 * Makes the next commit fail with a conflict even if its causes match.
	 */
	public synchronized void rejectNext() {
		++rejections;
	}
	@Override
	public CompletableFuture<CommitResult> commit(String space, List<Fact> writes, Map<String, FactReference> expectedCauses) {
		Objects.requireNonNull(space);
		List<Fact> facts = ImmutableList.copyOf(writes);
		Map<String, FactReference> expected = new HashMap<>(expectedCauses);
		CompletableFuture<CommitResult> future = new CompletableFuture<>();
		Runnable commit = () -> {
			CommitResult result = apply(space, facts, expected);
			if (result.ok())
				notify(space, result.revisions());
			future.complete(result);
		};
		synchronized (this) {
			if (paused) {
				held.add(commit);
				return future;
			}
		}
		commit.run();
		return future;
	}
	private synchronized CommitResult apply(String space, List<Fact> facts, Map<String, FactReference> expected) {
		for (Fact fact : facts) {
			EntityKey key = new EntityKey(space, fact.entity());
			Revision current = entities.get(key);
			FactReference actual = current != null ? current.fact().reference() : null;
			FactReference cause = expected.containsKey(fact.entity()) ? expected.get(fact.entity()) : fact.cause();
			if (rejections > 0 || !Objects.equals(actual, cause)) {
				if (rejections > 0)
					--rejections;
				logger.debug("Rejecting commit in space {}: expected {} for {}, found {}.", space, cause, fact.entity(), actual);
				return CommitResult.rejected(new CommitResult.Conflict(key, cause, current));
			}
		}
		List<Revision> revisions = new ArrayList<>();
		long since = sequences.getOrDefault(space, 0L);
		for (Fact fact : facts) {
			Revision revision = new Revision(fact, ++since);
			entities.put(new EntityKey(space, fact.entity()), revision);
			revisions.add(revision);
		}
		sequences.put(space, since);
		return CommitResult.success(revisions);
	}
	/**
	 * Simulates a write by another client on top of the current remote state.
	 *
	 * @param space
	 *            space of the entity
	 * @param entity
	 *            entity identifier
	 * @param value
	 *            new value of the entity
	 * @return confirmed revision
	 */
	public Revision write(String space, String entity, Object value) {
		Revision revision;
		synchronized (this) {
			Revision current = entities.get(new EntityKey(space, entity));
			Fact fact = current != null ? current.fact().next(ValuePaths.freeze(value)) : new Fact(entity, ValuePaths.freeze(value), null);
			long since = sequences.getOrDefault(space, 0L) + 1;
			revision = new Revision(fact, since);
			entities.put(new EntityKey(space, entity), revision);
			sequences.put(space, since);
		}
		notify(space, Collections.singletonList(revision));
		return revision;
	}
	private void notify(String space, List<Revision> revisions) {
		for (Revision revision : revisions) {
			List<Consumer<Revision>> listeners;
			synchronized (this) {
				listeners = new ArrayList<>(subscribers.get(new EntityKey(space, revision.fact().entity())));
			}
			for (Consumer<Revision> listener : listeners)
				ExceptionLogging.log(logger).run(() -> listener.accept(revision));
		}
	}
}
