// Part of Ripple
package com.machinezoo.ripple;

import java.time.*;
import java.util.*;
import java.util.Objects;
import java.util.concurrent.*;
import com.google.common.base.*;
import com.machinezoo.stagean.*;

/*
 * Defaults are tuned for interactive applications. Fast cycle threshold of 16ms is one frame at 60fps.
 * Scheduler takes a copy of the configuration, so changes made after construction have no effect.
 */
/**
 * Tunable limits and collaborators of {@link Scheduler}.
 * Setters return {@code this}. Getters share the name of the setter.
 */
@StubDocs
public class SchedulerConfig {
	public SchedulerConfig() {
	}
	public SchedulerConfig(SchedulerConfig other) {
		Objects.requireNonNull(other);
		maxIterationsPerRun = other.maxIterationsPerRun;
		maxCycleIterations = other.maxCycleIterations;
		fastCycleThreshold = other.fastCycleThreshold;
		autoDebounce = other.autoDebounce;
		autoDebounceThreshold = other.autoDebounceThreshold;
		autoDebounceMinRuns = other.autoDebounceMinRuns;
		autoDebounceCap = other.autoDebounceCap;
		maxCommitRetries = other.maxCommitRetries;
		eventRetries = other.eventRetries;
		pullMode = other.pullMode;
		ticker = other.ticker;
		executor = other.executor;
		timer = other.timer;
	}
	private static void positive(int value, String name) {
		if (value <= 0)
			throw new IllegalArgumentException(name + " must be positive.");
	}
	private static void nonNegative(Duration value, String name) {
		Objects.requireNonNull(value);
		if (value.isNegative())
			throw new IllegalArgumentException(name + " cannot be negative.");
	}
	private int maxIterationsPerRun = 100;
	/**
	 * Ceiling on runs of one action before the run-loop goes idle. Also the ceiling on slow cycle passes.
	 *
	 * @return maximum iterations
	 */
	public int maxIterationsPerRun() {
		return maxIterationsPerRun;
	}
	public SchedulerConfig maxIterationsPerRun(int maxIterationsPerRun) {
		positive(maxIterationsPerRun, "Iteration ceiling");
		this.maxIterationsPerRun = maxIterationsPerRun;
		return this;
	}
	private int maxCycleIterations = 20;
	public int maxCycleIterations() {
		return maxCycleIterations;
	}
	public SchedulerConfig maxCycleIterations(int maxCycleIterations) {
		positive(maxCycleIterations, "Cycle iteration bound");
		this.maxCycleIterations = maxCycleIterations;
		return this;
	}
	private Duration fastCycleThreshold = Duration.ofMillis(16);
	public Duration fastCycleThreshold() {
		return fastCycleThreshold;
	}
	public SchedulerConfig fastCycleThreshold(Duration fastCycleThreshold) {
		nonNegative(fastCycleThreshold, "Fast cycle threshold");
		this.fastCycleThreshold = fastCycleThreshold;
		return this;
	}
	private boolean autoDebounce = true;
	public boolean autoDebounce() {
		return autoDebounce;
	}
	public SchedulerConfig autoDebounce(boolean autoDebounce) {
		this.autoDebounce = autoDebounce;
		return this;
	}
	private Duration autoDebounceThreshold = Duration.ofMillis(50);
	public Duration autoDebounceThreshold() {
		return autoDebounceThreshold;
	}
	public SchedulerConfig autoDebounceThreshold(Duration autoDebounceThreshold) {
		nonNegative(autoDebounceThreshold, "Auto-debounce threshold");
		this.autoDebounceThreshold = autoDebounceThreshold;
		return this;
	}
	private int autoDebounceMinRuns = 4;
	/**
	 * Auto-debounce is considered only after the action ran more times than this.
	 *
	 * @return minimum sample size
	 */
	public int autoDebounceMinRuns() {
		return autoDebounceMinRuns;
	}
	public SchedulerConfig autoDebounceMinRuns(int autoDebounceMinRuns) {
		if (autoDebounceMinRuns < 0)
			throw new IllegalArgumentException("Minimum run count cannot be negative.");
		this.autoDebounceMinRuns = autoDebounceMinRuns;
		return this;
	}
	private Duration autoDebounceCap = Duration.ofMillis(200);
	public Duration autoDebounceCap() {
		return autoDebounceCap;
	}
	public SchedulerConfig autoDebounceCap(Duration autoDebounceCap) {
		nonNegative(autoDebounceCap, "Auto-debounce cap");
		this.autoDebounceCap = autoDebounceCap;
		return this;
	}
	private int maxCommitRetries = 10;
	public int maxCommitRetries() {
		return maxCommitRetries;
	}
	public SchedulerConfig maxCommitRetries(int maxCommitRetries) {
		if (maxCommitRetries < 0)
			throw new IllegalArgumentException("Retry count cannot be negative.");
		this.maxCommitRetries = maxCommitRetries;
		return this;
	}
	private int eventRetries = 5;
	/**
	 * Default number of times a queued event is handled again after its commit is rejected.
	 *
	 * @return event retry count
	 */
	public int eventRetries() {
		return eventRetries;
	}
	public SchedulerConfig eventRetries(int eventRetries) {
		if (eventRetries < 0)
			throw new IllegalArgumentException("Retry count cannot be negative.");
		this.eventRetries = eventRetries;
		return this;
	}
	private boolean pullMode = true;
	public boolean pullMode() {
		return pullMode;
	}
	public SchedulerConfig pullMode(boolean pullMode) {
		this.pullMode = pullMode;
		return this;
	}
	private Ticker ticker = Ticker.systemTicker();
	public Ticker ticker() {
		return ticker;
	}
	public SchedulerConfig ticker(Ticker ticker) {
		Objects.requireNonNull(ticker);
		this.ticker = ticker;
		return this;
	}
	private Executor executor = RunLoopExecutor.common();
	/**
	 * Run-loop executor. All scheduler and storage state is confined to tasks running here.
	 * It must run tasks one at a time.
	 *
	 * @return run-loop executor
	 */
	public Executor executor() {
		return executor;
	}
	public SchedulerConfig executor(Executor executor) {
		Objects.requireNonNull(executor);
		this.executor = executor;
		return this;
	}
	private static final ScheduledExecutorService defaultTimer = Executors.newSingleThreadScheduledExecutor(runnable -> {
		Thread thread = new Thread(runnable);
		thread.setDaemon(true);
		thread.setName("ripple-timer");
		return thread;
	});
	private ScheduledExecutorService timer = defaultTimer;
	/**
	 * Timer for debounce delays. Timer tasks only post work to {@link #executor()}.
	 *
	 * @return debounce timer
	 */
	public ScheduledExecutorService timer() {
		return timer;
	}
	public SchedulerConfig timer(ScheduledExecutorService timer) {
		Objects.requireNonNull(timer);
		this.timer = timer;
		return this;
	}
}
