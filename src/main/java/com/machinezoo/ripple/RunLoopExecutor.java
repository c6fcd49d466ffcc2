// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/*
 * Single-threaded executor that serves as the run-loop of the scheduler.
 *
 * Run-loop has a tick concept. Tick is a group of related tasks, typically a cascade started by one external change.
 * When a task schedules another task, the new task joins the current tick. Tasks scheduled from outside
 * of the run-loop, and tasks submitted via executeLater(), belong to the next tick.
 * This lets a storage change, the resulting notifications, and the run-loop pass they trigger run together,
 * while yielded work waits until everything queued in the current tick is done.
 *
 * Ticks and tasks are ordered by assigning increasing IDs and keeping the queue sorted by tick, then task.
 * Cascade depth within one tick is bounded, so that a busy-looping cascade cannot starve the next tick.
 */
/**
 * Single-threaded tick-ordered executor running scheduler and storage work.
 */
@StubDocs
public class RunLoopExecutor extends ThreadPoolExecutor {
	private static final ThreadLocal<Task> running = new ThreadLocal<>();
	private final AtomicLong tickCounter = new AtomicLong();
	private static final AtomicLong taskCounter = new AtomicLong();
	public long getTickCount() {
		return tickCounter.get();
	}
	private static final Timer taskTimer = Metrics.timer("ripple.executor.tasks");
	private static class Task implements Runnable, Comparable<Task> {
		final RunLoopExecutor executor;
		final long tick;
		final long taskId = taskCounter.incrementAndGet();
		final int depth;
		final Runnable runnable;
		final Timer.Sample sample;
		Task(RunLoopExecutor executor, long tick, int depth, Runnable runnable) {
			this.executor = executor;
			this.tick = tick;
			this.depth = depth;
			this.runnable = runnable;
			/*
			 * Only the common run-loop is timed. Sample starts here to include queuing latency.
			 */
			sample = executor == common ? Timer.start() : null;
		}
		@Override
		public int compareTo(Task other) {
			if (tick != other.tick)
				return tick < other.tick ? -1 : 1;
			return Long.compare(taskId, other.taskId);
		}
		@Override
		public void run() {
			/*
			 * First task of a tick opens the next tick for externally submitted tasks.
			 */
			executor.tickCounter.compareAndSet(tick, tick + 1);
			running.set(this);
			try {
				runnable.run();
			} finally {
				running.remove();
				if (sample != null)
					sample.stop(taskTimer);
			}
		}
	}
	public RunLoopExecutor(ThreadFactory threads) {
		super(1, 1, 0, TimeUnit.MILLISECONDS, new PriorityBlockingQueue<>(), threads);
	}
	public RunLoopExecutor() {
		this(Executors.defaultThreadFactory());
	}
	private static final int MAX_DEPTH = 30;
	@Override
	public void execute(Runnable runnable) {
		Objects.requireNonNull(runnable);
		Task current = running.get();
		if (current != null && current.executor == this && current.depth < MAX_DEPTH)
			super.execute(new Task(this, current.tick, current.depth + 1, runnable));
		else
			super.execute(new Task(this, tickCounter.get(), 0, runnable));
	}
	/**
	 * Schedules the task for the next tick even when called from within the run-loop.
	 *
	 * @param runnable
	 *            task to run after the current tick completes
	 */
	public void executeLater(Runnable runnable) {
		Objects.requireNonNull(runnable);
		Task current = running.get();
		long tick = tickCounter.get();
		if (current != null && current.executor == this)
			tick = Math.max(tick, current.tick + 1);
		super.execute(new Task(this, tick, 0, runnable));
	}
	/**
	 * Runs the task later if the executor supports ticks, otherwise submits it normally.
	 *
	 * @param executor
	 *            any executor
	 * @param runnable
	 *            task to run
	 */
	public static void later(Executor executor, Runnable runnable) {
		if (executor instanceof RunLoopExecutor)
			((RunLoopExecutor)executor).executeLater(runnable);
		else
			executor.execute(runnable);
	}
	public static RunLoopExecutor current() {
		Task task = running.get();
		return task != null ? task.executor : null;
	}
	/**
	 * Fails unless called from a task running on the given executor.
	 * Only {@link RunLoopExecutor} can be checked. Callers using other executors are responsible for running their calls as tasks of that executor.
	 *
	 * @param executor
	 *            executor that owns the state about to be accessed
	 * @throws IllegalStateException
	 *             if the executor is a {@link RunLoopExecutor} and the current thread is not running one of its tasks
	 */
	public static void confine(Executor executor) {
		if (executor instanceof RunLoopExecutor && current() != executor)
			throw new IllegalStateException("State owned by the run-loop can be accessed only from tasks running on the run-loop.");
	}
	private static final RunLoopExecutor common = new RunLoopExecutor(runnable -> {
		Thread thread = new Thread(runnable);
		/*
		 * Do not block process termination just because the run-loop still has queued work.
		 */
		thread.setDaemon(true);
		thread.setName("ripple-loop");
		return thread;
	});
	static {
		Metrics.gauge("ripple.executor.ticks", common, x -> x.getTickCount());
		Metrics.gauge("ripple.executor.queue", common, x -> x.getQueue().size());
	}
	public static RunLoopExecutor common() {
		return common;
	}
}
