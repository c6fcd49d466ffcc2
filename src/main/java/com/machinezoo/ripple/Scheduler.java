// Part of Ripple
package com.machinezoo.ripple;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.*;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.ripple.storage.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;
import it.unimi.dsi.fastutil.ints.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Scheduler owns the action registry, the dependency graph, the dirty set, and the pending set.
 * It is confined to the run-loop executor. Everything that reaches it from other threads
 * (debounce timers, remote confirmations) is posted to the executor first.
 *
 * In pull mode, storage changes schedule only effects. Computations are marked dirty
 * and they are brought up to date when an effect about to run pulls them.
 * In push mode, every affected action is scheduled and the run-loop runs them in topological order.
 *
 * Run-loop runs pending actions in passes. Every pass increments per-action loop counters,
 * which are reset when the run-loop goes idle. An action exceeding the ceiling is reported and dropped
 * from the pending set, but the rest of the pass continues.
 *
 * Actions subscribed while another action is running become its children. Parents run before children.
 *
 * Events are queued by the application and handled one per pass, before the pending actions of that pass run,
 * so that actions triggered by the event's writes run in the same pass. Rejected event commits put the event
 * back at the head of the queue until its retries are used up.
 *
 * Scheduler state is confined to the run-loop. When the executor is a RunLoopExecutor, public methods
 * called from outside of its tasks throw instead of racing the run-loop. Only idle() may be called from anywhere.
 */
/**
 * Reactive scheduler running actions in response to storage changes.
 */
@DraftDocs("usage example with TierManager and executor")
public class Scheduler {
	private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);
	private static final Timer runTimer = Metrics.timer("ripple.scheduler.runs");
	private static final Counter limitCounter = Metrics.counter("ripple.scheduler.iteration.limit");
	private static final Counter conflictCounter = Metrics.counter("ripple.scheduler.conflicts");
	private static final Counter eventCounter = Metrics.counter("ripple.scheduler.events");
	/*
	 * Default diagnostic handler applies to schedulers without their own handlers, like a default uncaught exception handler.
	 */
	private static Consumer<SchedulerDiagnostic> diagnosticDefault = diagnostic -> {
		if (diagnostic.kind() == DiagnosticKind.CYCLE_NOT_CONVERGED)
			logger.warn("{}", diagnostic, diagnostic.cause());
		else
			logger.error("{}", diagnostic, diagnostic.cause());
	};
	public static synchronized Consumer<SchedulerDiagnostic> diagnosticDefault() {
		return diagnosticDefault;
	}
	public static synchronized void diagnosticDefault(Consumer<SchedulerDiagnostic> handler) {
		Objects.requireNonNull(handler);
		diagnosticDefault = handler;
	}
	private static class Node {
		final int id;
		final Action action;
		final String name;
		boolean effect;
		int parent = -1;
		final IntSet children = new IntLinkedOpenHashSet();
		boolean captured;
		Node(int id, Action action, String name) {
			this.id = id;
			this.action = action;
			this.name = name;
		}
	}
	private static class QueuedEvent {
		final Address stream;
		final EventHandler handler;
		final Object event;
		final int retries;
		final BiConsumer<CommitResult, Throwable> onCommit;
		int attempts;
		int deferrals;
		QueuedEvent(Address stream, EventHandler handler, Object event, int retries, BiConsumer<CommitResult, Throwable> onCommit) {
			this.stream = stream;
			this.handler = handler;
			this.event = event;
			this.retries = retries;
			this.onCommit = onCommit;
		}
		String name() {
			return "event on " + stream;
		}
	}
	private final SchedulerConfig config;
	private final TierManager tiers;
	private final DependencyTracker tracker = new DependencyTracker();
	private final CycleHandler cycles;
	private final DebounceController debounce;
	private final Reference2IntMap<Action> ids = new Reference2IntOpenHashMap<>();
	private final Int2ObjectMap<Node> nodes = new Int2ObjectOpenHashMap<>();
	private int nextId;
	private final IntSet effects = new IntLinkedOpenHashSet();
	private final IntSet computations = new IntLinkedOpenHashSet();
	private final IntSet dirty = new IntOpenHashSet();
	private final IntSet pending = new IntLinkedOpenHashSet();
	private final Int2IntMap loops = new Int2IntOpenHashMap();
	private final Int2IntMap retries = new Int2IntOpenHashMap();
	private final Int2ObjectMap<ActionStats> stats = new Int2ObjectOpenHashMap<>();
	private final IntSet converging = new IntOpenHashSet();
	private final List<Consumer<SchedulerDiagnostic>> handlers = new CopyOnWriteArrayList<>();
	private final List<CompletableFuture<Void>> idlers = new ArrayList<>();
	private final ListMultimap<Address, EventHandler> eventHandlers = ArrayListMultimap.create();
	private final Deque<QueuedEvent> events = new ArrayDeque<>();
	private int committing;
	private boolean pullMode;
	private boolean scheduled;
	private boolean executing;
	private int deferred;
	private int current = -1;
	public Scheduler(TierManager tiers, SchedulerConfig config) {
		Objects.requireNonNull(tiers);
		Objects.requireNonNull(config);
		this.tiers = tiers;
		this.config = new SchedulerConfig(config);
		pullMode = this.config.pullMode();
		ids.defaultReturnValue(-1);
		cycles = new CycleHandler(this, this.config);
		debounce = new DebounceController(this.config);
		tiers.listen(this::changed);
	}
	public Scheduler(TierManager tiers) {
		this(tiers, new SchedulerConfig());
	}
	public TierManager tiers() {
		return tiers;
	}
	public SchedulerConfig config() {
		return new SchedulerConfig(config);
	}
	DependencyTracker tracker() {
		return tracker;
	}
	private void confined() {
		RunLoopExecutor.confine(config.executor());
	}
	private int id(Action action) {
		Objects.requireNonNull(action);
		return ids.getInt(action);
	}
	private String name(int id) {
		Node node = nodes.get(id);
		return node != null ? node.name : "action#" + id;
	}
	private int parent(int id) {
		Node node = nodes.get(id);
		return node != null ? node.parent : -1;
	}
	/*
	 * Registration.
	 */
	/**
	 * Registers an action or updates registration of an already subscribed action.
	 *
	 * @param action
	 *            action to register
	 * @param log
	 *            known reads and writes of the action, possibly empty
	 * @param options
	 *            kind and scheduling options
	 */
	public void subscribe(Action action, ReactivityLog log, SubscribeOptions options) {
		Objects.requireNonNull(action);
		Objects.requireNonNull(log);
		Objects.requireNonNull(options);
		confined();
		int id = ids.getInt(action);
		Node node;
		if (id < 0) {
			id = nextId++;
			node = new Node(id, action, options.name() != null ? options.name() : "action#" + id);
			ids.put(action, id);
			nodes.put(id, node);
			if (current >= 0 && nodes.containsKey(current)) {
				node.parent = current;
				nodes.get(current).children.add(id);
			}
		} else
			node = nodes.get(id);
		node.effect = options.effect();
		if (node.effect) {
			effects.add(id);
			computations.remove(id);
		} else {
			computations.add(id);
			effects.remove(id);
		}
		if (!log.isEmpty())
			node.captured = true;
		debounce.configure(id, options);
		tracker.subscribe(id, log);
		logger.debug("Subscribed {} {}.", node.effect ? "effect" : "computation", node.name);
		if (options.scheduleImmediately()) {
			if (pullMode && !node.effect) {
				markDirty(id);
				if (!node.captured)
					pending.add(id);
				scheduleAffectedEffects(id);
			} else
				pending.add(id);
			queueExecution();
		}
	}
	public void subscribe(Action action, SubscribeOptions options) {
		subscribe(action, ReactivityLog.empty(), options);
	}
	/**
	 * Removes the action from the graph, the dirty set, the pending set, and cancels its debounce timer.
	 * Action that is currently running finishes, but its writes are not committed.
	 *
	 * @param action
	 *            action to remove
	 */
	public void unsubscribe(Action action) {
		confined();
		int id = id(action);
		if (id < 0)
			return;
		ids.removeInt(action);
		Node node = nodes.remove(id);
		if (node.parent >= 0 && nodes.containsKey(node.parent))
			nodes.get(node.parent).children.remove(id);
		for (int child : node.children) {
			Node orphan = nodes.get(child);
			if (orphan != null)
				orphan.parent = -1;
		}
		effects.remove(id);
		computations.remove(id);
		dirty.remove(id);
		pending.remove(id);
		loops.remove(id);
		retries.remove(id);
		stats.remove(id);
		debounce.forget(id);
		cycles.forget(id);
		tracker.unsubscribe(id);
		logger.debug("Unsubscribed {}.", node.name);
		settleIdle();
	}
	/*
	 * Dirty marking and triggering.
	 */
	/**
	 * Marks the computation stale together with every computation that transitively depends on it.
	 * Propagation stops at computations that are already dirty.
	 * In pull mode, effects depending on the computation are scheduled, so that they pull it.
	 * Effects are never dirty. Marking an effect schedules it.
	 *
	 * @param action
	 *            action to mark
	 */
	public void markDirty(Action action) {
		confined();
		int id = id(action);
		if (id < 0)
			return;
		if (effects.contains(id))
			scheduleWithDebounce(id);
		else {
			markDirty(id);
			if (pullMode)
				scheduleAffectedEffects(id);
		}
	}
	/*
	 * Propagation passes through effects without marking them, because an effect
	 * that reruns retriggers its dependents through its own writes.
	 */
	void markDirty(int id) {
		IntSet visited = new IntOpenHashSet();
		IntArrayList stack = new IntArrayList();
		stack.push(id);
		while (!stack.isEmpty()) {
			int next = stack.popInt();
			if (!visited.add(next))
				continue;
			if (computations.contains(next) && !dirty.add(next))
				continue;
			for (int dependent : tracker.dependents(next))
				if (!dirty.contains(dependent))
					stack.push(dependent);
		}
	}
	/**
	 * Triggers every action whose reads overlap the address, as if the value at the address changed.
	 *
	 * @param address
	 *            changed address
	 */
	public void markDirty(Address address) {
		Objects.requireNonNull(address);
		confined();
		IntList triggered = new IntArrayList();
		for (int reader : tracker.readers(address.key()))
			if (tracker.log(reader).reads(address))
				triggered.add(reader);
		for (int reader : triggered)
			trigger(reader);
	}
	private void trigger(int id) {
		if (!nodes.containsKey(id))
			return;
		if (pullMode && computations.contains(id)) {
			markDirty(id);
			scheduleAffectedEffects(id);
		} else
			scheduleWithDebounce(id);
	}
	private void scheduleAffectedEffects(int id) {
		IntSet visited = new IntOpenHashSet();
		IntArrayList stack = new IntArrayList();
		stack.push(id);
		while (!stack.isEmpty()) {
			int next = stack.popInt();
			if (!visited.add(next))
				continue;
			if (effects.contains(next))
				scheduleWithDebounce(next);
			for (int dependent : tracker.dependents(next))
				stack.push(dependent);
		}
	}
	/**
	 * Adds the action to the pending set now or, if it has a debounce interval, after the interval elapses without another trigger.
	 *
	 * @param action
	 *            action to schedule
	 */
	public void scheduleWithDebounce(Action action) {
		confined();
		int id = id(action);
		if (id >= 0)
			scheduleWithDebounce(id);
	}
	private void scheduleWithDebounce(int id) {
		debounce.schedule(id, this::enqueue);
	}
	private void enqueue(int id) {
		if (!nodes.containsKey(id)) {
			settleIdle();
			return;
		}
		if (pullMode && computations.contains(id) && nodes.get(id).captured) {
			markDirty(id);
			scheduleAffectedEffects(id);
		} else
			pending.add(id);
		queueExecution();
	}
	private void changed(List<StorageChange> changes) {
		IntSet triggered = new IntLinkedOpenHashSet();
		for (StorageChange change : changes)
			for (int reader : tracker.readers(change.key()))
				if (reader != current && affected(reader, change))
					triggered.add(reader);
		for (int id : triggered)
			trigger(id);
	}
	private boolean affected(int id, StorageChange change) {
		for (Address read : tracker.log(id).reads())
			if (change.affects(read))
				return true;
		return false;
	}
	/*
	 * Run-loop.
	 */
	private void queueExecution() {
		if (scheduled || executing)
			return;
		scheduled = true;
		config.executor().execute(ExceptionLogging.log(logger).runnable(() -> {
			scheduled = false;
			execute();
		}));
	}
	/**
	 * Runs one pass over the pending set in topological order.
	 * If work remains afterwards, another pass is queued on the executor.
	 */
	public void execute() {
		confined();
		if (executing)
			throw new IllegalStateException("Run-loop pass is already in progress.");
		executing = true;
		try {
			IntSet blockers = dispatchEvent();
			pending.addAll(blockers);
			IntList work = new IntArrayList();
			for (int id : pending)
				if (!pullMode || effects.contains(id) || !nodes.get(id).captured || blockers.contains(id))
					work.add(id);
			for (int id : order(work)) {
				if (!pending.contains(id))
					continue;
				int count = loops.get(id) + 1;
				loops.put(id, count);
				if (count > config.maxIterationsPerRun()) {
					pending.remove(id);
					limitCounter.increment();
					report(DiagnosticKind.ITERATION_LIMIT_EXCEEDED, id, count - 1, "Action was scheduled " + (count - 1) + " times without the run-loop going idle.", null);
					continue;
				}
				run(id);
			}
		} finally {
			executing = false;
		}
		if (!pending.isEmpty() || !events.isEmpty())
			queueExecution();
		else {
			loops.clear();
			settleIdle();
		}
	}
	private boolean idleNow() {
		return !executing && !scheduled && pending.isEmpty() && events.isEmpty() && committing == 0 && deferred == 0 && !debounce.waiting();
	}
	private void settleIdle() {
		if (!idleNow() || idlers.isEmpty())
			return;
		List<CompletableFuture<Void>> completed = new ArrayList<>(idlers);
		idlers.clear();
		for (CompletableFuture<Void> future : completed)
			future.complete(null);
	}
	/**
	 * Returns future completed when the run-loop has nothing left to execute.
	 * Pending debounce timers, deferred slow cycles, queued events, and unsettled event commits count as work.
	 * This method may be called from any thread.
	 *
	 * @return idle future
	 */
	public CompletableFuture<Void> idle() {
		Executor executor = config.executor();
		if (executor instanceof RunLoopExecutor && RunLoopExecutor.current() != executor) {
			CompletableFuture<Void> future = new CompletableFuture<>();
			executor.execute(ExceptionLogging.log(logger).runnable(() -> idle().thenRun(() -> future.complete(null))));
			return future;
		}
		if (idleNow())
			return CompletableFuture.completedFuture(null);
		CompletableFuture<Void> future = new CompletableFuture<>();
		idlers.add(future);
		return future;
	}
	IntList order(IntCollection actions) {
		return TopologicalOrder.sort(actions, tracker, this::parent);
	}
	/**
	 * Runs the action now. In pull mode, dirty computations the action depends on are brought up to date first.
	 *
	 * @param action
	 *            action to run
	 * @return outcome of the run
	 */
	public RunOutcome run(Action action) {
		confined();
		int id = id(action);
		if (id < 0)
			return RunOutcome.SKIPPED;
		return run(id);
	}
	private RunOutcome run(int id) {
		if (!pullMode) {
			pending.remove(id);
			return invoke(id);
		}
		RunOutcome pulled = pull(id, new IntArrayList(), id);
		pending.remove(id);
		if (pulled == RunOutcome.DEFERRED) {
			defer(id);
			return RunOutcome.DEFERRED;
		}
		RunOutcome outcome = invoke(id);
		return pulled == RunOutcome.SLOW_CYCLE_TIMEOUT && outcome == RunOutcome.OK ? pulled : outcome;
	}
	private RunOutcome pull(int id, IntArrayList stack, int driver) {
		stack.push(id);
		try {
			for (int provider : new IntArrayList(tracker.providers(id))) {
				if (!computations.contains(provider) || converging.contains(provider))
					continue;
				IntSet members = cycles.active(provider);
				int index = stack.indexOf(provider);
				if (members == null && !dirty.contains(provider))
					continue;
				if (members == null && index >= 0) {
					members = new IntLinkedOpenHashSet(stack.subList(index, stack.size()));
					logger.debug("Detected cycle of {} actions while pulling {}.", members.size(), name(driver));
				}
				if (members != null) {
					CycleHandler.Outcome outcome = cycles.handle(members, driver, stack);
					if (outcome == CycleHandler.Outcome.YIELDED)
						return RunOutcome.DEFERRED;
					if (outcome == CycleHandler.Outcome.TIMED_OUT)
						return RunOutcome.SLOW_CYCLE_TIMEOUT;
					continue;
				}
				RunOutcome outcome = pull(provider, stack, driver);
				if (outcome == RunOutcome.DEFERRED || outcome == RunOutcome.SLOW_CYCLE_TIMEOUT)
					return outcome;
				if (dirty.contains(provider) && !converging.contains(provider))
					invoke(provider);
			}
			return RunOutcome.OK;
		} finally {
			stack.popInt();
		}
	}
	void refresh(int id, IntArrayList stack, int driver) {
		pull(id, stack, driver);
		invoke(id);
	}
	private void defer(int id) {
		++deferred;
		logger.debug("Deferring {} to a later tick.", name(id));
		RunLoopExecutor.later(config.executor(), ExceptionLogging.log(logger).runnable(() -> {
			--deferred;
			enqueue(id);
			settleIdle();
		}));
	}
	private CloseableScope enter(int id) {
		int outer = current;
		current = id;
		return () -> current = outer;
	}
	CloseableScope converging(IntSet members) {
		IntSet added = new IntOpenHashSet();
		for (int member : members)
			if (converging.add(member))
				added.add(member);
		return () -> converging.removeAll(added);
	}
	boolean isDirty(int id) {
		return dirty.contains(id);
	}
	void clean(IntSet members) {
		dirty.removeAll(members);
	}
	ActionStats stats(int id) {
		return stats.getOrDefault(id, ActionStats.empty);
	}
	/*
	 * Runs the action body in a fresh transaction, records its statistics, replaces its reactivity log, and commits.
	 * Storage notifications caused by the action's own commit are not delivered back to the action itself.
	 */
	private RunOutcome invoke(int id) {
		Node node = nodes.get(id);
		if (node == null)
			return RunOutcome.SKIPPED;
		ActionStats previous = stats(id);
		Duration throttled = debounce.throttled(id, previous, config.ticker().read());
		if (throttled != null) {
			logger.debug("Throttling {} for another {}ms.", node.name, throttled.toMillis());
			if (node.effect || !pullMode)
				debounce.delay(id, throttled, this::enqueue);
			else
				dirty.add(id);
			return RunOutcome.THROTTLED;
		}
		dirty.remove(id);
		Transaction transaction = tiers.begin();
		Throwable failure = null;
		CompletableFuture<CommitResult> commit = null;
		try (CloseableScope running = enter(id)) {
			long start = config.ticker().read();
			Span span = GlobalTracer.get().buildSpan("ripple.run")
				.withTag("component", "ripple")
				.withTag("action", node.name)
				.withTag("kind", node.effect ? "effect" : "computation")
				.start();
			try (Scope trace = GlobalTracer.get().activateSpan(span)) {
				tracker.capture(node.action, transaction);
			} catch (Throwable ex) {
				failure = ex;
			} finally {
				span.finish();
			}
			long end = config.ticker().read();
			Duration elapsed = Duration.ofNanos(end - start);
			runTimer.record(elapsed);
			if (nodes.get(id) != node) {
				transaction.abort();
				return RunOutcome.SKIPPED;
			}
			ActionStats updated = previous.record(elapsed, end);
			stats.put(id, updated);
			debounce.recorded(id, updated);
			node.captured = true;
			if (pullMode && !node.effect)
				pending.remove(id);
			tracker.subscribe(id, transaction.log());
			if (failure == null) {
				/*
				 * Commit throws when the action closed its own transaction or when the tiers cannot accept its writes.
				 * Tiers stay untouched in both cases and the run is reported like any other failure.
				 */
				try {
					commit = transaction.commit();
				} catch (Throwable ex) {
					failure = ex;
				}
			} else
				transaction.abort();
		}
		if (failure != null) {
			report(DiagnosticKind.ACTION_FAILED, id, 0, "Action threw " + failure.getClass().getSimpleName() + ".", failure);
			return RunOutcome.FAILED;
		}
		commit.whenComplete((result, exception) -> committed(id, node, result, exception));
		if (commit.isDone() && (commit.isCompletedExceptionally() || !commit.join().ok()))
			return RunOutcome.COMMIT_CONFLICT;
		return RunOutcome.OK;
	}
	private void committed(int id, Node node, CommitResult result, Throwable exception) {
		if (nodes.get(id) != node)
			return;
		if (exception == null && result.ok()) {
			retries.remove(id);
			return;
		}
		conflictCounter.increment();
		int attempt = retries.get(id) + 1;
		String reason = exception != null ? "Commit failed" : "Commit rejected: " + result.conflict();
		if (attempt > config.maxCommitRetries()) {
			retries.remove(id);
			report(DiagnosticKind.COMMIT_CONFLICT, id, attempt - 1, reason + ". Giving up after " + (attempt - 1) + " retries.", exception);
			return;
		}
		retries.put(id, attempt);
		report(DiagnosticKind.COMMIT_CONFLICT, id, attempt, reason + ". Retrying.", exception);
		if (pullMode && !node.effect) {
			markDirty(id);
			scheduleAffectedEffects(id);
		} else {
			pending.add(id);
			queueExecution();
		}
	}
	/*
	 * Events.
	 */
	/**
	 * Registers handler for events queued on the stream address.
	 * Every handler registered for the stream receives every event queued on it.
	 *
	 * @param stream
	 *            address identifying the event stream
	 * @param handler
	 *            handler to register
	 * @return scope that removes the handler when closed
	 */
	public CloseableScope addEventHandler(Address stream, EventHandler handler) {
		Objects.requireNonNull(stream);
		Objects.requireNonNull(handler);
		confined();
		eventHandlers.put(stream, handler);
		return () -> {
			confined();
			eventHandlers.remove(stream, handler);
		};
	}
	/**
	 * Queues event for every handler of the stream. Queued events are handled in FIFO order, one per run-loop pass.
	 * Handler's writes are committed in one transaction. Rejected commit puts the event back at the head of the queue
	 * until the retries are used up.
	 *
	 * @param stream
	 *            address identifying the event stream
	 * @param event
	 *            event passed to the handlers
	 * @param retries
	 *            number of times the event is handled again after a rejected commit
	 * @param onCommit
	 *            called with the final commit result, or with the exception that prevented the commit, may be {@code null}
	 * @return number of handlers the event was queued for
	 */
	public int queueEvent(Address stream, Object event, int retries, BiConsumer<CommitResult, Throwable> onCommit) {
		Objects.requireNonNull(stream);
		if (retries < 0)
			throw new IllegalArgumentException("Retry count cannot be negative.");
		confined();
		List<EventHandler> receivers = new ArrayList<>(eventHandlers.get(stream));
		if (receivers.isEmpty()) {
			logger.debug("No handler for events on {}.", stream);
			return 0;
		}
		for (EventHandler handler : receivers)
			events.addLast(new QueuedEvent(stream, handler, event, retries, onCommit));
		queueExecution();
		return receivers.size();
	}
	public int queueEvent(Address stream, Object event) {
		return queueEvent(stream, event, config.eventRetries(), null);
	}
	/*
	 * In pull mode, an event whose handler declares reads that dirty computations might write goes back
	 * to the head of the queue, and the computations run in the current pass instead.
	 * Waiting is bounded by the iteration ceiling, after which the handler runs with the values it finds.
	 */
	private IntSet dispatchEvent() {
		QueuedEvent queued = events.pollFirst();
		if (queued == null)
			return IntSets.EMPTY_SET;
		if (pullMode) {
			IntSet blockers;
			try {
				blockers = blockers(queued);
			} catch (Throwable ex) {
				eventFailed(queued, ex);
				return IntSets.EMPTY_SET;
			}
			if (!blockers.isEmpty()) {
				if (queued.deferrals < config.maxIterationsPerRun()) {
					++queued.deferrals;
					logger.debug("Deferring {} until {} dirty computations run.", queued.name(), blockers.size());
					events.addFirst(queued);
					return blockers;
				}
				limitCounter.increment();
				report(DiagnosticKind.ITERATION_LIMIT_EXCEEDED, queued.name(), queued.deferrals, "Event waited for dirty computations " + queued.deferrals + " times. Handling it with current values.", null);
			}
		}
		handle(queued);
		return IntSets.EMPTY_SET;
	}
	private IntSet blockers(QueuedEvent queued) {
		Transaction declared = tiers.begin();
		try {
			queued.handler.dependencies(declared, queued.event);
		} finally {
			declared.abort();
		}
		IntSet blockers = new IntLinkedOpenHashSet();
		for (Address read : declared.log().reads())
			for (int id : dirty)
				for (Address write : tracker.mightWrite(id))
					if (write.overlaps(read))
						blockers.add(id);
		return blockers;
	}
	private void handle(QueuedEvent queued) {
		eventCounter.increment();
		Transaction transaction = tiers.begin();
		CompletableFuture<CommitResult> commit = null;
		Throwable failure = null;
		Span span = GlobalTracer.get().buildSpan("ripple.event")
			.withTag("component", "ripple")
			.withTag("stream", queued.stream.toString())
			.start();
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			queued.handler.handle(transaction, queued.event);
			commit = transaction.commit();
		} catch (Throwable ex) {
			failure = ex;
		} finally {
			span.finish();
		}
		if (failure != null) {
			if (transaction.open())
				transaction.abort();
			eventFailed(queued, failure);
			return;
		}
		++committing;
		commit.whenComplete((result, exception) -> {
			--committing;
			eventCommitted(queued, result, exception);
		});
	}
	private void eventFailed(QueuedEvent queued, Throwable failure) {
		report(DiagnosticKind.ACTION_FAILED, queued.name(), 0, "Event handler threw " + failure.getClass().getSimpleName() + ".", failure);
		completed(queued, null, failure);
	}
	private void eventCommitted(QueuedEvent queued, CommitResult result, Throwable exception) {
		if (exception == null && result.ok()) {
			completed(queued, result, null);
			return;
		}
		conflictCounter.increment();
		String reason = exception != null ? "Commit failed" : "Commit rejected: " + result.conflict();
		if (queued.attempts < queued.retries) {
			++queued.attempts;
			report(DiagnosticKind.COMMIT_CONFLICT, queued.name(), queued.attempts, reason + ". Retrying.", exception);
			events.addFirst(queued);
			queueExecution();
			return;
		}
		report(DiagnosticKind.COMMIT_CONFLICT, queued.name(), queued.attempts, reason + ". Giving up after " + queued.attempts + " retries.", exception);
		completed(queued, result, exception);
	}
	private void completed(QueuedEvent queued, CommitResult result, Throwable exception) {
		if (queued.onCommit != null)
			ExceptionLogging.log(logger).run(() -> queued.onCommit.accept(result, exception));
		settleIdle();
	}
	/*
	 * Diagnostics.
	 */
	/**
	 * Registers handler for diagnostics of this scheduler.
	 * Without any registered handler, diagnostics go to {@link #diagnosticDefault()}.
	 *
	 * @param handler
	 *            diagnostic consumer
	 */
	public void onDiagnostic(Consumer<SchedulerDiagnostic> handler) {
		Objects.requireNonNull(handler);
		handlers.add(handler);
	}
	void report(DiagnosticKind kind, int id, int iterations, String message, Throwable cause) {
		report(kind, name(id), iterations, message, cause);
	}
	private void report(DiagnosticKind kind, String source, int iterations, String message, Throwable cause) {
		SchedulerDiagnostic diagnostic = new SchedulerDiagnostic(kind, source, iterations, message, cause);
		logger.debug("Reporting {}.", diagnostic);
		if (handlers.isEmpty()) {
			Consumer<SchedulerDiagnostic> fallback = diagnosticDefault();
			ExceptionLogging.log(logger).run(() -> fallback.accept(diagnostic));
		} else {
			for (Consumer<SchedulerDiagnostic> handler : handlers)
				ExceptionLogging.log(logger).run(() -> handler.accept(diagnostic));
		}
	}
	/*
	 * Mode switch.
	 */
	public boolean isPullModeEnabled() {
		return pullMode;
	}
	public void enablePullMode() {
		confined();
		if (pullMode)
			return;
		pullMode = true;
		for (int id : new IntArrayList(pending)) {
			if (computations.contains(id) && nodes.get(id).captured) {
				pending.remove(id);
				markDirty(id);
				scheduleAffectedEffects(id);
			}
		}
		logger.debug("Switched to pull mode.");
	}
	/**
	 * Switches to push mode. Dirty computations are scheduled and the dirty set is cleared.
	 */
	public void disablePullMode() {
		confined();
		if (!pullMode)
			return;
		pullMode = false;
		for (int id : dirty)
			if (nodes.containsKey(id))
				pending.add(id);
		dirty.clear();
		if (!pending.isEmpty())
			queueExecution();
		logger.debug("Switched to push mode.");
	}
	/*
	 * Introspection.
	 */
	public boolean isEffect(Action action) {
		confined();
		int id = id(action);
		return id >= 0 && effects.contains(id);
	}
	public boolean isComputation(Action action) {
		confined();
		int id = id(action);
		return id >= 0 && computations.contains(id);
	}
	public boolean isDirty(Action action) {
		confined();
		int id = id(action);
		return id >= 0 && dirty.contains(id);
	}
	public boolean isPending(Action action) {
		confined();
		int id = id(action);
		return id >= 0 && pending.contains(id);
	}
	public ReactivityLog log(Action action) {
		confined();
		int id = id(action);
		return id >= 0 ? tracker.log(id) : null;
	}
	private Set<Action> actions(IntCollection handles) {
		Set<Action> set = Collections.newSetFromMap(new IdentityHashMap<>());
		for (int handle : handles) {
			Node node = nodes.get(handle);
			if (node != null)
				set.add(node.action);
		}
		return set;
	}
	/**
	 * Lists actions that read something the given action might write.
	 *
	 * @param action
	 *            subscribed action
	 * @return identity set of dependent actions
	 */
	public Set<Action> dependents(Action action) {
		confined();
		int id = id(action);
		return id >= 0 ? actions(tracker.dependents(id)) : Collections.emptySet();
	}
	public Action parent(Action action) {
		confined();
		int id = id(action);
		Node parent = id >= 0 ? nodes.get(parent(id)) : null;
		return parent != null ? parent.action : null;
	}
	/**
	 * Run time statistics of the action.
	 *
	 * @param action
	 *            subscribed action
	 * @return statistics or {@code null} if the action is not subscribed
	 */
	public ActionStats stats(Action action) {
		confined();
		int id = id(action);
		return id >= 0 ? stats(id) : null;
	}
	/**
	 * Effective debounce interval, configured or auto-detected.
	 *
	 * @param action
	 *            subscribed action
	 * @return debounce interval or {@code null} if the action is not debounced
	 */
	public Duration debounce(Action action) {
		confined();
		int id = id(action);
		return id >= 0 ? debounce.debounce(id) : null;
	}
	public void debounce(Action action, Duration interval) {
		confined();
		int id = id(action);
		if (id < 0)
			throw new IllegalArgumentException("Action is not subscribed.");
		if (interval != null && interval.isNegative())
			throw new IllegalArgumentException("Debounce interval cannot be negative.");
		debounce.debounce(id, interval);
	}
	/**
	 * Number of passes taken so far by a slow cycle containing the action that has not converged yet.
	 *
	 * @param action
	 *            subscribed action
	 * @return pass count or zero if the action is not in an unsettled slow cycle
	 */
	public int cycleIterations(Action action) {
		confined();
		int id = id(action);
		return id >= 0 ? cycles.iterations(id) : 0;
	}
	/**
	 * Finds cycles among the given actions.
	 *
	 * @param actions
	 *            actions to examine
	 * @return strongly connected components with more than one member
	 */
	public List<Set<Action>> detectCycles(Collection<Action> actions) {
		confined();
		IntList handles = new IntArrayList();
		for (Action action : actions) {
			int id = id(action);
			if (id >= 0)
				handles.add(id);
		}
		List<Set<Action>> result = new ArrayList<>();
		for (IntSet component : cycles.detect(handles))
			result.add(actions(component));
		return result;
	}
	public SchedulerStats getStats() {
		confined();
		return stats();
	}
	private SchedulerStats stats() {
		return new SchedulerStats(effects.size(), computations.size(), pending.size(), dirty.size());
	}
	@Override
	public String toString() {
		return "scheduler: " + stats();
	}
}
