// Part of Ripple
package com.machinezoo.ripple;

import java.time.*;
import java.util.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import io.micrometer.core.instrument.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Cycles are found during pulls, when a computation turns out to be already on the pull stack.
 * Cheap cycles are iterated to fixpoint on the spot, so that the effect waiting for them never sees intermediate values.
 * Expensive cycles run one pass per tick and the waiting effect is deferred until the cycle settles.
 *
 * A cycle is identified by its membership. State of slow cycles is kept across ticks in explicit records.
 * Any later pull that reaches a member of an unsettled slow cycle continues that cycle instead of running the member alone.
 * Both paths are bounded. Fast path gives up after maxCycleIterations passes and lets the effect proceed.
 * Slow path gives up after maxIterationsPerRun passes and reports the timeout against the driving effect.
 */
class CycleHandler {
	private static final Logger logger = LoggerFactory.getLogger(CycleHandler.class);
	private static final Counter cycleCounter = Metrics.counter("ripple.scheduler.cycles");
	enum Outcome {
		CONVERGED,
		NOT_CONVERGED,
		YIELDED,
		TIMED_OUT
	}
	private static class CycleState {
		final IntSet members;
		int iteration;
		long lastYield;
		CycleState(IntSet members) {
			this.members = members;
		}
	}
	private final Scheduler scheduler;
	private final SchedulerConfig config;
	private final Map<IntSet, CycleState> slow = new HashMap<>();
	CycleHandler(Scheduler scheduler, SchedulerConfig config) {
		this.scheduler = scheduler;
		this.config = config;
	}
	Duration estimate(IntSet members) {
		Duration total = Duration.ZERO;
		for (int member : members)
			total = total.plus(scheduler.stats(member).averageTime());
		return total;
	}
	Outcome handle(IntSet members, int driver, IntArrayList stack) {
		cycleCounter.increment();
		if (slow.containsKey(members)) {
			logger.debug("Resuming slow cycle of {} actions.", members.size());
			return step(members, driver, stack);
		}
		Duration estimate = estimate(members);
		if (estimate.compareTo(config.fastCycleThreshold()) < 0) {
			logger.debug("Converging fast cycle of {} actions estimated at {}ms.", members.size(), estimate.toMillis());
			return converge(members, driver, stack);
		}
		logger.debug("Stepping slow cycle of {} actions estimated at {}ms.", members.size(), estimate.toMillis());
		return step(members, driver, stack);
	}
	private boolean settled(IntSet members) {
		for (int member : members)
			if (scheduler.isDirty(member))
				return false;
		return true;
	}
	private void pass(IntSet members, int driver, IntArrayList stack) {
		IntList dirty = new IntArrayList();
		for (int member : members)
			if (scheduler.isDirty(member))
				dirty.add(member);
		for (int member : scheduler.order(dirty))
			if (scheduler.isDirty(member))
				scheduler.refresh(member, stack, driver);
	}
	private Outcome converge(IntSet members, int driver, IntArrayList stack) {
		try (CloseableScope converging = scheduler.converging(members)) {
			for (int iteration = 0; iteration < config.maxCycleIterations(); ++iteration) {
				if (settled(members)) {
					logger.debug("Cycle converged after {} passes.", iteration);
					return Outcome.CONVERGED;
				}
				pass(members, driver, stack);
			}
			if (settled(members))
				return Outcome.CONVERGED;
			scheduler.report(DiagnosticKind.CYCLE_NOT_CONVERGED, driver, config.maxCycleIterations(),
				"Cycle of " + members.size() + " actions did not converge, proceeding with latest values.", null);
			scheduler.clean(members);
			return Outcome.NOT_CONVERGED;
		}
	}
	private Outcome step(IntSet members, int driver, IntArrayList stack) {
		IntSet key = new IntOpenHashSet(members);
		CycleState state = slow.computeIfAbsent(key, CycleState::new);
		++state.iteration;
		if (state.iteration > config.maxIterationsPerRun()) {
			slow.remove(key);
			scheduler.report(DiagnosticKind.SLOW_CYCLE_TIMEOUT, driver, state.iteration - 1,
				"Slow cycle of " + members.size() + " actions did not converge across ticks.", null);
			scheduler.clean(members);
			return Outcome.TIMED_OUT;
		}
		try (CloseableScope converging = scheduler.converging(members)) {
			pass(members, driver, stack);
		}
		if (settled(members)) {
			logger.debug("Slow cycle converged after {} ticks.", state.iteration);
			slow.remove(key);
			return Outcome.CONVERGED;
		}
		state.lastYield = config.ticker().read();
		return Outcome.YIELDED;
	}
	/**
	 * Members of the unsettled slow cycle containing the action or null if there is no such cycle.
	 */
	IntSet active(int id) {
		for (CycleState state : slow.values())
			if (state.members.contains(id))
				return state.members;
		return null;
	}
	/**
	 * Number of passes the slow cycle containing the action has taken so far.
	 */
	int iterations(int id) {
		for (CycleState state : slow.values())
			if (state.members.contains(id))
				return state.iteration;
		return 0;
	}
	void forget(int id) {
		slow.values().removeIf(state -> state.members.contains(id));
	}
	/*
	 * Tarjan's strongly connected components over the subgraph induced by the given actions.
	 * Only components with more than one member are cycles. Self-loops are not tracked by the dependency graph.
	 */
	List<IntSet> detect(IntCollection actions) {
		IntSet scope = new IntLinkedOpenHashSet(actions);
		Int2IntMap index = new Int2IntOpenHashMap();
		Int2IntMap lowlink = new Int2IntOpenHashMap();
		IntSet onStack = new IntOpenHashSet();
		IntArrayList stack = new IntArrayList();
		List<IntSet> components = new ArrayList<>();
		int[] counter = new int[1];
		for (int action : scope)
			if (!index.containsKey(action))
				connect(action, scope, index, lowlink, onStack, stack, components, counter);
		return components;
	}
	private void connect(int action, IntSet scope, Int2IntMap index, Int2IntMap lowlink, IntSet onStack, IntArrayList stack, List<IntSet> components, int[] counter) {
		index.put(action, counter[0]);
		lowlink.put(action, counter[0]);
		++counter[0];
		stack.push(action);
		onStack.add(action);
		for (int dependent : scheduler.tracker().dependents(action)) {
			if (!scope.contains(dependent))
				continue;
			if (!index.containsKey(dependent)) {
				connect(dependent, scope, index, lowlink, onStack, stack, components, counter);
				lowlink.put(action, Math.min(lowlink.get(action), lowlink.get(dependent)));
			} else if (onStack.contains(dependent))
				lowlink.put(action, Math.min(lowlink.get(action), index.get(dependent)));
		}
		if (lowlink.get(action) == index.get(action)) {
			IntSet component = new IntLinkedOpenHashSet();
			int member;
			do {
				member = stack.popInt();
				onStack.remove(member);
				component.add(member);
			} while (member != action);
			if (component.size() > 1)
				components.add(component);
		}
	}
}
