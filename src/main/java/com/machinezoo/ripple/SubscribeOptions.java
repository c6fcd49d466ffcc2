// Part of Ripple
package com.machinezoo.ripple;

import java.time.*;

/**
 * Per-subscription options for {@link Scheduler#subscribe(Action, com.machinezoo.ripple.storage.ReactivityLog, SubscribeOptions)}.
 * Setters return {@code this}. Getters share the name of the setter.
 */
public class SubscribeOptions {
	private boolean effect;
	/**
	 * Effects are observable sinks and scheduling roots. Everything else is a computation run only on demand in pull mode.
	 *
	 * @return {@code true} if the action is an effect
	 */
	public boolean effect() {
		return effect;
	}
	public SubscribeOptions effect(boolean effect) {
		this.effect = effect;
		return this;
	}
	private boolean scheduleImmediately = true;
	public boolean scheduleImmediately() {
		return scheduleImmediately;
	}
	/**
	 * Controls whether subscription also schedules the action.
	 * Without immediate scheduling, the supplied log alone decides when the action runs.
	 *
	 * @param scheduleImmediately
	 *            {@code false} to only register triggers
	 * @return {@code this}
	 */
	public SubscribeOptions scheduleImmediately(boolean scheduleImmediately) {
		this.scheduleImmediately = scheduleImmediately;
		return this;
	}
	private String name;
	public String name() {
		return name;
	}
	public SubscribeOptions name(String name) {
		this.name = name;
		return this;
	}
	private Duration debounce;
	public Duration debounce() {
		return debounce;
	}
	public SubscribeOptions debounce(Duration debounce) {
		if (debounce != null && debounce.isNegative())
			throw new IllegalArgumentException("Debounce interval cannot be negative.");
		this.debounce = debounce;
		return this;
	}
	private Boolean autoDebounce;
	/**
	 * Overrides {@link SchedulerConfig#autoDebounce()} for this action.
	 *
	 * @return {@code null} to inherit the scheduler default
	 */
	public Boolean autoDebounce() {
		return autoDebounce;
	}
	public SubscribeOptions autoDebounce(Boolean autoDebounce) {
		this.autoDebounce = autoDebounce;
		return this;
	}
	private Duration throttle;
	public Duration throttle() {
		return throttle;
	}
	public SubscribeOptions throttle(Duration throttle) {
		if (throttle != null && throttle.isNegative())
			throw new IllegalArgumentException("Throttle period cannot be negative.");
		this.throttle = throttle;
		return this;
	}
	public static SubscribeOptions forEffect() {
		return new SubscribeOptions().effect(true);
	}
	public static SubscribeOptions forComputation() {
		return new SubscribeOptions();
	}
}
