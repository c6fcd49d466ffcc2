// Part of Ripple
package com.machinezoo.ripple;

/**
 * Diagnostic counts returned by {@link Scheduler#getStats()}.
 */
public final class SchedulerStats {
	private final int effects;
	public int effects() {
		return effects;
	}
	private final int computations;
	public int computations() {
		return computations;
	}
	private final int pending;
	public int pending() {
		return pending;
	}
	private final int dirty;
	public int dirty() {
		return dirty;
	}
	SchedulerStats(int effects, int computations, int pending, int dirty) {
		this.effects = effects;
		this.computations = computations;
		this.pending = pending;
		this.dirty = dirty;
	}
	@Override
	public String toString() {
		return effects + " effects, " + computations + " computations, " + pending + " pending, " + dirty + " dirty";
	}
}
