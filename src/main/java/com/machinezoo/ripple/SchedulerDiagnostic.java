// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;

/**
 * Report of a recoverable problem isolated to one action, cycle, or queued event.
 * Diagnostics never stop the run-loop.
 *
 * @see Scheduler#onDiagnostic(java.util.function.Consumer)
 */
public final class SchedulerDiagnostic {
	private final DiagnosticKind kind;
	public DiagnosticKind kind() {
		return kind;
	}
	private final String action;
	/**
	 * Name of the affected action. For cycles, this is the effect driving the cycle.
	 * For queued events, this is {@code "event on "} followed by the stream address.
	 *
	 * @return action name
	 */
	public String action() {
		return action;
	}
	private final int iterations;
	public int iterations() {
		return iterations;
	}
	private final String message;
	public String message() {
		return message;
	}
	private final Throwable cause;
	public Throwable cause() {
		return cause;
	}
	public SchedulerDiagnostic(DiagnosticKind kind, String action, int iterations, String message, Throwable cause) {
		Objects.requireNonNull(kind);
		Objects.requireNonNull(action);
		Objects.requireNonNull(message);
		this.kind = kind;
		this.action = action;
		this.iterations = iterations;
		this.message = message;
		this.cause = cause;
	}
	@Override
	public String toString() {
		return kind + " in " + action + " after " + iterations + " iterations: " + message;
	}
}
