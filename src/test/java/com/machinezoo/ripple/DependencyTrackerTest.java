// Part of Ripple
package com.machinezoo.ripple;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.ripple.storage.*;

public class DependencyTrackerTest {
	DependencyTracker t = new DependencyTracker();
	static final Address a = Address.of("s", "e", "a");
	static final Address b = Address.of("s", "e", "b");
	static ReactivityLog log(List<Address> reads, List<Address> writes) {
		return new ReactivityLog(reads, writes);
	}
	@Test
	public void edges() {
		t.subscribe(1, log(List.of(), List.of(a)));
		t.subscribe(2, log(List.of(a), List.of()));
		// Writer feeds reader.
		assertTrue(t.feeds(1, 2));
		assertFalse(t.feeds(2, 1));
		assertThat(t.dependents(1), contains(2));
		assertThat(t.providers(2), contains(1));
		assertThat(t.readers(a.key()), contains(2));
	}
	@Test
	public void subscriptionOrder() {
		// Reader subscribed first is linked when the writer shows up.
		t.subscribe(2, log(List.of(a), List.of()));
		t.subscribe(1, log(List.of(), List.of(a)));
		assertTrue(t.feeds(1, 2));
	}
	@Test
	public void pathOverlap() {
		t.subscribe(1, log(List.of(), List.of(a)));
		t.subscribe(2, log(List.of(b), List.of()));
		t.subscribe(3, log(List.of(Address.of("s", "e")), List.of()));
		t.subscribe(4, log(List.of(a.child("x")), List.of()));
		// Sibling paths are independent.
		assertFalse(t.feeds(1, 2));
		// Whole-entity reads and nested reads overlap.
		assertTrue(t.feeds(1, 3));
		assertTrue(t.feeds(1, 4));
	}
	@Test
	public void writesAccumulate() {
		t.subscribe(1, log(List.of(), List.of(a)));
		t.subscribe(2, log(List.of(a), List.of()));
		// Run that skipped the write keeps the edge.
		t.subscribe(1, log(List.of(), List.of()));
		assertTrue(t.feeds(1, 2));
		assertThat(t.mightWrite(1), contains(a));
		assertTrue(t.log(1).writes().isEmpty());
	}
	@Test
	public void readsReplaced() {
		t.subscribe(1, log(List.of(), List.of(a)));
		t.subscribe(2, log(List.of(a), List.of()));
		// Dropped read removes the edge.
		t.subscribe(2, log(List.of(b), List.of()));
		assertFalse(t.feeds(1, 2));
		assertTrue(t.readers(a.key()).contains(2));
		assertTrue(t.providers(2).isEmpty());
	}
	@Test
	public void noSelfEdges() {
		t.subscribe(1, log(List.of(a), List.of(a)));
		assertFalse(t.feeds(1, 1));
		assertTrue(t.dependents(1).isEmpty());
	}
	@Test
	public void unsubscribe() {
		t.subscribe(1, log(List.of(), List.of(a)));
		t.subscribe(2, log(List.of(a), List.of(b)));
		t.subscribe(3, log(List.of(b), List.of()));
		t.unsubscribe(2);
		assertFalse(t.contains(2));
		assertTrue(t.dependents(1).isEmpty());
		assertTrue(t.providers(3).isEmpty());
		assertFalse(t.readers(a.key()).contains(2));
		assertEquals(ReactivityLog.empty(), t.log(2));
	}
	@Test
	public void capture() {
		TierManager tiers = new TierManager(new InMemoryRemoteStore(), new MemoryFactCache(), new TestLoop());
		Transaction transaction = tiers.begin();
		ReactivityLog log = t.capture(tx -> tx.write(b, tx.read(a)), transaction);
		assertEquals(List.of(a), log.reads());
		assertEquals(List.of(b), log.writes());
		// Capture does not register the log.
		assertFalse(t.contains(0));
	}
}
