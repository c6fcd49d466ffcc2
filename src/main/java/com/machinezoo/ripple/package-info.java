// Part of Ripple
/*
 * Diagnostic conventions of the scheduler package:
 * - Null check is performed on method parameters where appropriate.
 * - Exceptions from actions are caught, reported as diagnostics, and the action's transaction is aborted.
 * - Exceptions from application callbacks (diagnostic handlers, storage listeners) are logged and never unwind the run-loop.
 * - Loop control never uses exceptions. Outcomes are returned as RunOutcome values.
 * - Metrics are exposed through Micrometer's global registry. Every action run gets an OpenTracing span.
 */
/**
 * Reactive scheduler with dependency tracking, cycle convergence, and debouncing.
 *
 * @see com.machinezoo.ripple.Scheduler
 */
package com.machinezoo.ripple;
