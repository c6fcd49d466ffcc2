// Part of Ripple
package com.machinezoo.ripple;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.stream.*;
import org.junit.jupiter.api.*;
import com.machinezoo.ripple.storage.*;
import it.unimi.dsi.fastutil.ints.*;

public class CycleHandlerTest {
	TestLoop loop = new TestLoop();
	ManualTicker ticker = new ManualTicker();
	TierManager tiers = new TierManager(new InMemoryRemoteStore(), new MemoryFactCache(), loop);
	List<SchedulerDiagnostic> diagnostics = new ArrayList<>();
	Scheduler s;
	final Address a = Address.of("s", "e", "a");
	final Address b = Address.of("s", "e", "b");
	final Address limit = Address.of("s", "limit");
	final List<Integer> seen = new ArrayList<>();
	/*
	 * Computation A copies b into a. Computation B sets b to a + 1, bounded by the limit when one is given,
	 * or to a plus the limit when the cycle is unbounded. Effect E observes b.
	 */
	Action follower;
	Action incrementer;
	Action observer;
	static int num(Object value) {
		return value != null ? ((Number)value).intValue() : 0;
	}
	void setup(SchedulerConfig config, boolean bounded, int cost) {
		s = new Scheduler(tiers, config.executor(loop).ticker(ticker));
		s.onDiagnostic(diagnostics::add);
		tiers.set(limit, 0);
		loop.drain();
		follower = tx -> {
			ticker.advance(cost);
			tx.write(a, num(tx.read(b)));
		};
		incrementer = tx -> {
			ticker.advance(cost);
			int value = num(tx.read(a));
			int bound = num(tx.read(limit));
			tx.write(b, bounded ? Math.min(value + 1, bound) : value + bound);
		};
		observer = tx -> seen.add(num(tx.read(b)));
		s.subscribe(follower, SubscribeOptions.forComputation().name("follower"));
		s.subscribe(incrementer, SubscribeOptions.forComputation().name("incrementer"));
		s.subscribe(observer, SubscribeOptions.forEffect().name("observer"));
		loop.drain();
	}
	List<DiagnosticKind> kinds() {
		return diagnostics.stream().map(SchedulerDiagnostic::kind).collect(Collectors.toList());
	}
	@Test
	public void fastConverges() {
		setup(new SchedulerConfig(), true, 0);
		assertEquals(List.of(0), seen);
		tiers.set(limit, 5);
		loop.drain();
		// Cheap cycle runs to fixpoint before the effect runs, so the effect sees only the final value.
		assertEquals(List.of(0, 5), seen);
		assertEquals(5, tiers.get(a));
		assertTrue(diagnostics.isEmpty());
		assertEquals(0, s.cycleIterations(follower));
		assertFalse(s.isDirty(follower));
		assertFalse(s.isDirty(incrementer));
	}
	@Test
	public void fastGivesUp() {
		setup(new SchedulerConfig().maxCycleIterations(20), false, 0);
		assertEquals(List.of(0), seen);
		tiers.set(limit, 1);
		loop.drain();
		// Divergent cycle is cut off and the effect proceeds with the latest value.
		assertEquals(List.of(DiagnosticKind.CYCLE_NOT_CONVERGED), kinds());
		assertEquals("observer", diagnostics.get(0).action());
		assertEquals(20, diagnostics.get(0).iterations());
		assertEquals(2, seen.size());
		assertThat(seen.get(1), greaterThan(1));
		assertTrue(s.idle().isDone());
	}
	@Test
	public void slowYields() {
		setup(new SchedulerConfig(), true, 20);
		assertEquals(List.of(0), seen);
		tiers.set(limit, 5);
		// Expensive cycle takes one pass per tick and the effect waits for it.
		s.execute();
		assertEquals(List.of(0), seen);
		assertEquals(1, s.cycleIterations(follower));
		assertEquals(1, s.cycleIterations(incrementer));
		assertFalse(s.idle().isDone());
		loop.drain();
		assertEquals(List.of(0, 5), seen);
		assertEquals(0, s.cycleIterations(follower));
		assertTrue(diagnostics.isEmpty());
		assertTrue(s.idle().isDone());
	}
	@Test
	public void slowTimesOut() {
		setup(new SchedulerConfig().maxIterationsPerRun(5), false, 20);
		tiers.set(limit, 1);
		loop.drain();
		assertEquals(List.of(DiagnosticKind.SLOW_CYCLE_TIMEOUT), kinds());
		assertEquals(5, diagnostics.get(0).iterations());
		// Effect runs with whatever the cycle computed so far.
		assertEquals(2, seen.size());
		assertEquals(0, s.cycleIterations(follower));
		assertTrue(s.idle().isDone());
	}
	@Test
	public void estimate() {
		setup(new SchedulerConfig(), true, 20);
		CycleHandler handler = new CycleHandler(s, new SchedulerConfig());
		// Estimate sums average run times of the members.
		assertEquals(Duration.ofMillis(40), handler.estimate(new IntOpenHashSet(new int[] { 0, 1 })));
	}
}
