// Part of Ripple
package com.machinezoo.ripple;

/**
 * Result of {@link Scheduler#run(Action)}.
 */
public enum RunOutcome {
	/**
	 * Action ran and its writes were handed to the commit protocol.
	 */
	OK,
	/**
	 * Action exceeded its per-run loop counter and was not run.
	 */
	ITERATION_LIMIT_EXCEEDED,
	/**
	 * Commit was rejected before the action returned. Retry is scheduled if retries remain.
	 */
	COMMIT_CONFLICT,
	/**
	 * Slow cycle the action depends on did not converge within the global ceiling.
	 */
	SLOW_CYCLE_TIMEOUT,
	/**
	 * Action body threw. Nothing was committed.
	 */
	FAILED,
	/**
	 * Slow cycle yielded and the action was re-enqueued for a later tick.
	 */
	DEFERRED,
	/**
	 * Action ran within its throttle period and was left dirty.
	 */
	THROTTLED,
	/**
	 * Action is not subscribed.
	 */
	SKIPPED
}
