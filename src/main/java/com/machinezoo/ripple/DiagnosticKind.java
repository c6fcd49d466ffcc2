// Part of Ripple
package com.machinezoo.ripple;

/**
 * Category of {@link SchedulerDiagnostic}.
 */
public enum DiagnosticKind {
	/**
	 * Action was scheduled too many times before the run-loop went idle, or an event waited too long for dirty computations.
	 */
	ITERATION_LIMIT_EXCEEDED,
	COMMIT_CONFLICT,
	SLOW_CYCLE_TIMEOUT,
	/**
	 * Fast cycle did not reach fixpoint within its iteration bound. Observers proceed with the latest values.
	 */
	CYCLE_NOT_CONVERGED,
	/**
	 * Action body or event handler threw an exception, or its writes could not be committed.
	 */
	ACTION_FAILED
}
