// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;

/*
 * Boundary to the authoritative store. Transport, wire format, and authorization live behind this interface.
 * Futures and subscription callbacks may complete on any thread. TierManager marshals them onto its executor.
 */
/**
 * Remote authoritative store of facts.
 *
 * @see InMemoryRemoteStore
 */
public interface RemoteStore {
	/**
	 * Fetches current state of an entity.
	 *
	 * @param space
	 *            space of the entity
	 * @param entity
	 *            entity identifier
	 * @return future completed with the current revision or with {@code null} if the entity does not exist
	 */
	CompletableFuture<Revision> pull(String space, String entity);
	/**
	 * Subscribes to updates of an entity. Subscribing twice with the same listener has no additional effect.
	 *
	 * @param space
	 *            space of the entity
	 * @param entity
	 *            entity identifier
	 * @param listener
	 *            receives every newly confirmed revision
	 */
	void subscribe(String space, String entity, Consumer<Revision> listener);
	void unsubscribe(String space, String entity, Consumer<Revision> listener);
	/**
	 * Commits facts atomically within one space.
	 * Every entity's current fact must match the expected cause, otherwise nothing is applied.
	 *
	 * @param space
	 *            space of all the facts
	 * @param writes
	 *            new facts
	 * @param expectedCauses
	 *            expected current fact per entity identifier, {@code null} value meaning the entity must be absent
	 * @return future completed with confirmed revisions or with a conflict
	 */
	CompletableFuture<CommitResult> commit(String space, List<Fact> writes, Map<String, FactReference> expectedCauses);
}
