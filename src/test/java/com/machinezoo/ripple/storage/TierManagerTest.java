// Part of Ripple
package com.machinezoo.ripple.storage;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;
import com.machinezoo.ripple.*;

public class TierManagerTest {
	TestLoop loop;
	InMemoryRemoteStore remote;
	MemoryFactCache cache;
	TierManager tiers;
	List<StorageChange> changes;
	final EntityKey key = new EntityKey("space1", "e1");
	final Address count = Address.of("space1", "e1", "count");
	@BeforeEach
	public void setup() {
		loop = new TestLoop();
		remote = new InMemoryRemoteStore();
		cache = new MemoryFactCache();
		tiers = new TierManager(remote, cache, loop);
		changes = new ArrayList<>();
		tiers.listen(changes::addAll);
	}
	private void seed(int value) {
		remote.write("space1", "e1", Map.of("count", value));
		tiers.load(key);
		loop.drain();
		changes.clear();
	}
	@Test
	public void fetchOnMiss() {
		remote.write("space1", "e1", Map.of("count", 1));
		// Nothing is known locally, so the read misses and starts a fetch.
		assertNull(tiers.get(count));
		assertNull(tiers.entry(key).tier());
		loop.drain();
		// Fetched value lands in the heap and listeners hear about it.
		assertThat(tiers.get(count), equalTo(1));
		assertEquals(Tier.HEAP, tiers.entry(key).tier());
		assertEquals(1, changes.size());
		assertEquals(StorageChange.Kind.LOAD, changes.get(0).kind());
		// Fetched data is written through to the cache.
		assertNotNull(cache.get(key));
	}
	@Test
	public void missingEntity() {
		CompletableFuture<Void> loaded = tiers.load(key);
		assertFalse(loaded.isDone());
		loop.drain();
		assertTrue(loaded.isDone());
		// Known absence does not trigger another fetch.
		assertNull(tiers.get(count));
		assertEquals(0, loop.size());
		assertTrue(changes.isEmpty());
	}
	@Test
	public void nurseryShadowsHeap() {
		seed(1);
		remote.pause();
		CompletableFuture<CommitResult> commit = tiers.set(count, 2);
		// Local write is visible before the remote store confirms it.
		assertThat(tiers.get(count), equalTo(2));
		TierEntry entry = tiers.entry(key);
		assertEquals(Tier.NURSERY, entry.tier());
		assertThat(ValuePaths.get(entry.heap().fact().value(), count.path()), equalTo(1));
		assertEquals(1, tiers.pending(key).size());
		assertFalse(commit.isDone());
		assertEquals(StorageChange.Kind.COMMIT, changes.get(0).kind());
	}
	@Test
	public void commitPromotes() {
		seed(1);
		CompletableFuture<CommitResult> commit = tiers.set(count, 2);
		loop.drain();
		assertTrue(commit.join().ok());
		// Confirmed write moves from nursery to heap and cache.
		TierEntry entry = tiers.entry(key);
		assertNull(entry.nursery());
		assertEquals(Tier.HEAP, entry.tier());
		assertThat(tiers.get(count), equalTo(2));
		assertThat(ValuePaths.get(cache.get(key).fact().value(), count.path()), equalTo(2));
		assertTrue(tiers.pending(key).isEmpty());
		// Promotion does not change what readers see, so the only notification is the commit itself.
		assertEquals(1, changes.size());
	}
	@Test
	public void rejectedCommitRollsBack() {
		seed(1);
		remote.rejectNext();
		CompletableFuture<CommitResult> commit = tiers.set(count, 3);
		assertThat(tiers.get(count), equalTo(3));
		loop.drain();
		assertFalse(commit.join().ok());
		// Nursery entry is purged and the confirmed value shows through again.
		assertNull(tiers.entry(key).nursery());
		assertThat(tiers.get(count), equalTo(1));
		assertTrue(tiers.pending(key).isEmpty());
		assertEquals(StorageChange.Kind.REVERT, changes.get(changes.size() - 1).kind());
	}
	@Test
	public void localConflict() {
		seed(1);
		Transaction transaction = tiers.begin();
		assertThat(transaction.read(count), equalTo(1));
		// Another write lands between the read and the commit.
		tiers.set(count, 5);
		transaction.write(count, 6);
		CompletableFuture<CommitResult> commit = transaction.commit();
		// Local CAS check rejects the whole transaction at once.
		assertTrue(commit.isDone());
		CommitResult result = commit.join();
		assertFalse(result.ok());
		assertEquals(key, result.conflict().key());
		assertThat(tiers.get(count), equalTo(5));
	}
	@Test
	public void atomicRejection() {
		seed(1);
		remote.write("space1", "e2", 10);
		tiers.load(new EntityKey("space1", "e2"));
		loop.drain();
		Transaction transaction = tiers.begin();
		transaction.write(Address.of("space1", "e2"), 11);
		transaction.read(count);
		tiers.set(count, 5);
		transaction.write(count, 6);
		assertFalse(transaction.commit().join().ok());
		// No part of the rejected transaction is applied.
		assertThat(tiers.get(Address.of("space1", "e2")), equalTo(10));
		assertNull(tiers.entry(new EntityKey("space1", "e2")).nursery());
	}
	@Test
	public void redundantWrite() {
		seed(1);
		CommitResult result = tiers.set(count, 1).join();
		// Writing the current value creates no fact.
		assertTrue(result.ok());
		assertTrue(result.revisions().isEmpty());
		assertNull(tiers.entry(key).nursery());
		assertTrue(changes.isEmpty());
	}
	@Test
	public void remoteUpdate() {
		seed(1);
		remote.write("space1", "e1", Map.of("count", 4));
		loop.drain();
		assertThat(tiers.get(count), equalTo(4));
		assertEquals(1, changes.size());
		StorageChange change = changes.get(0);
		assertEquals(StorageChange.Kind.INTEGRATE, change.kind());
		assertTrue(change.affects(count));
		assertFalse(change.affects(Address.of("space1", "e1", "other")));
	}
	@Test
	public void staleUpdateIgnored() {
		seed(1);
		Revision old = tiers.entry(key).heap();
		remote.write("space1", "e1", Map.of("count", 2));
		loop.drain();
		changes.clear();
		tiers.integrate(key, old);
		assertThat(tiers.get(count), equalTo(2));
		assertTrue(changes.isEmpty());
	}
	@Test
	public void conflictingRemoteUpdatePurgesNursery() {
		seed(1);
		remote.pause();
		tiers.set(count, 2);
		// Another client wins the race.
		remote.write("space1", "e1", Map.of("count", 7));
		loop.drain();
		assertNull(tiers.entry(key).nursery());
		assertThat(tiers.get(count), equalTo(7));
		// Our held commit is then rejected by the remote store and nothing changes.
		remote.resume();
		loop.drain();
		assertThat(tiers.get(count), equalTo(7));
		assertNull(tiers.entry(key).nursery());
	}
	@Test
	public void localWriteOnTopIsRetained() {
		seed(1);
		remote.pause();
		tiers.set(count, 2);
		tiers.set(count, 3);
		Fact newest = tiers.entry(key).nursery();
		assertEquals(2, tiers.pending(key).size());
		remote.resume();
		// Confirmation of the first write arrives first. Nursery holds the second write built on top of it.
		assertTrue(loop.step());
		assertEquals(newest, tiers.entry(key).nursery());
		assertThat(tiers.get(count), equalTo(3));
		loop.drain();
		// Eventually the second write is confirmed too.
		assertNull(tiers.entry(key).nursery());
		assertEquals(newest, tiers.entry(key).heap().fact());
		assertTrue(tiers.pending(key).isEmpty());
	}
	@Test
	public void cacheServesFirstAccess() {
		seed(1);
		// New session shares the persistent cache, but the remote store is unreachable.
		TierManager session = new TierManager(new InMemoryRemoteStore(), cache, loop);
		assertThat(session.get(count), equalTo(1));
		assertEquals(Tier.HEAP, session.entry(key).tier());
	}
	@Test
	public void singleSpace() {
		Transaction transaction = tiers.begin();
		transaction.write(Address.of("a", "e"), 1);
		assertThrows(IllegalStateException.class, () -> transaction.write(Address.of("b", "e"), 1));
	}
	@Test
	public void closedTransaction() {
		Transaction transaction = tiers.begin();
		transaction.write(count, 1);
		transaction.abort();
		assertFalse(transaction.open());
		assertThrows(IllegalStateException.class, () -> transaction.read(count));
		assertThrows(IllegalStateException.class, transaction::commit);
	}
	@Test
	public void unsupportedValue() {
		Transaction transaction = tiers.begin();
		transaction.write(count, 1);
		Address blob = Address.of("space1", "e2", "blob");
		assertThrows(IllegalArgumentException.class, () -> transaction.write(blob, new Object()));
		// Rejected write is not recorded and the transaction stays usable.
		assertEquals(List.of(count), transaction.log().writes());
		assertNull(transaction.read(blob));
		transaction.commit();
		loop.drain();
		assertEquals(1, tiers.get(count));
		assertTrue(tiers.pending(key).isEmpty());
	}
	@Test
	public void reactivityLog() {
		seed(1);
		Transaction transaction = tiers.begin();
		transaction.read(count);
		transaction.read(count);
		transaction.write(Address.of("space1", "e1", "total"), 2);
		// Own writes are visible to later reads.
		assertThat(transaction.read(Address.of("space1", "e1", "total")), equalTo(2));
		ReactivityLog log = transaction.log();
		assertEquals(Arrays.asList(count, Address.of("space1", "e1", "total")), log.reads());
		assertEquals(Arrays.asList(Address.of("space1", "e1", "total")), log.writes());
	}
	@Test
	public void reset() {
		seed(1);
		remote.pause();
		tiers.set(count, 2);
		tiers.reset();
		assertNull(tiers.entry(key).nursery());
		assertNull(tiers.entry(key).heap());
		assertTrue(tiers.pending(key).isEmpty());
	}
	@Test
	public void retraction() {
		seed(1);
		tiers.set(Address.of("space1", "e1"), null);
		loop.drain();
		assertNull(tiers.get(count));
		assertTrue(tiers.entry(key).heap().fact().retracted());
	}
}
