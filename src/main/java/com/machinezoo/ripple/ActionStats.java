// Part of Ripple
package com.machinezoo.ripple;

import java.time.*;

/*
 * Immutable, so that snapshots handed out to callers never change under them.
 * Timestamps come from the scheduler's ticker and are only comparable with each other.
 */
/**
 * Run time statistics of one action.
 */
public final class ActionStats {
	private final int runCount;
	public int runCount() {
		return runCount;
	}
	private final Duration totalTime;
	public Duration totalTime() {
		return totalTime;
	}
	private final Duration lastRunTime;
	public Duration lastRunTime() {
		return lastRunTime;
	}
	private final long lastRunTimestamp;
	/**
	 * Ticker reading at the end of the last run.
	 *
	 * @return timestamp in nanoseconds
	 */
	public long lastRunTimestamp() {
		return lastRunTimestamp;
	}
	private ActionStats(int runCount, Duration totalTime, Duration lastRunTime, long lastRunTimestamp) {
		this.runCount = runCount;
		this.totalTime = totalTime;
		this.lastRunTime = lastRunTime;
		this.lastRunTimestamp = lastRunTimestamp;
	}
	static final ActionStats empty = new ActionStats(0, Duration.ZERO, Duration.ZERO, 0);
	public Duration averageTime() {
		return runCount == 0 ? Duration.ZERO : totalTime.dividedBy(runCount);
	}
	ActionStats record(Duration elapsed, long timestamp) {
		return new ActionStats(runCount + 1, totalTime.plus(elapsed), elapsed, timestamp);
	}
	@Override
	public String toString() {
		return runCount + " runs, average " + averageTime().toMillis() + "ms";
	}
}
