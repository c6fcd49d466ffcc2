// Part of Ripple
package com.machinezoo.ripple;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.IntConsumer;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Debounce coalesces a burst of triggers into one run after a quiet period.
 * Interval is either configured at subscription or assigned automatically to actions that are slow to run.
 * Auto-detected interval is twice the average run time, capped.
 *
 * Throttle is the opposite policy. It drops runs that come too soon after the last run.
 * Dropped runs are retried when the period ends, except for computations in pull mode, which stay dirty until pulled again.
 *
 * Timers fire on the timer thread, but they only post work to the run-loop executor.
 * Every armed timer carries a token. When it fires, the posted task checks that the token is still current,
 * so that a timer that was replaced or cancelled after firing but before its task ran has no effect.
 */
class DebounceController {
	private static final Logger logger = LoggerFactory.getLogger(DebounceController.class);
	private final SchedulerConfig config;
	private final Int2ObjectMap<Duration> configured = new Int2ObjectOpenHashMap<>();
	private final Int2ObjectMap<Duration> automatic = new Int2ObjectOpenHashMap<>();
	private final Int2ObjectMap<Boolean> autoEnabled = new Int2ObjectOpenHashMap<>();
	private final Int2ObjectMap<Duration> throttles = new Int2ObjectOpenHashMap<>();
	private final Int2ObjectMap<ScheduledFuture<?>> timers = new Int2ObjectOpenHashMap<>();
	private final Int2ObjectMap<Object> tokens = new Int2ObjectOpenHashMap<>();
	DebounceController(SchedulerConfig config) {
		this.config = config;
	}
	void configure(int id, SubscribeOptions options) {
		debounce(id, options.debounce());
		if (options.autoDebounce() != null)
			autoEnabled.put(id, options.autoDebounce());
		else
			autoEnabled.remove(id);
		if (options.throttle() != null && !options.throttle().isZero())
			throttles.put(id, options.throttle());
		else
			throttles.remove(id);
	}
	Duration debounce(int id) {
		Duration interval = configured.get(id);
		return interval != null ? interval : automatic.get(id);
	}
	void debounce(int id, Duration interval) {
		if (interval != null && !interval.isZero())
			configured.put(id, interval);
		else
			configured.remove(id);
	}
	private boolean autoEnabled(int id) {
		Boolean enabled = autoEnabled.get(id);
		return enabled != null ? enabled : config.autoDebounce();
	}
	/**
	 * Hands the action to the sink now or after its debounce interval.
	 * Any timer already armed for the action is replaced.
	 */
	void schedule(int id, IntConsumer sink) {
		Duration interval = debounce(id);
		if (interval == null) {
			cancel(id);
			sink.accept(id);
		} else
			delay(id, interval, sink);
	}
	void delay(int id, Duration interval, IntConsumer sink) {
		cancel(id);
		Object token = new Object();
		tokens.put(id, token);
		logger.trace("Delaying action {} by {}ms.", id, interval.toMillis());
		timers.put(id, config.timer().schedule(ExceptionLogging.log(logger).runnable(() -> config.executor().execute(() -> {
			if (tokens.get(id) == token) {
				tokens.remove(id);
				timers.remove(id);
				sink.accept(id);
			}
		})), interval.toNanos(), TimeUnit.NANOSECONDS));
	}
	void cancel(int id) {
		tokens.remove(id);
		ScheduledFuture<?> timer = timers.remove(id);
		if (timer != null)
			timer.cancel(false);
	}
	boolean waiting() {
		return !timers.isEmpty();
	}
	boolean waiting(int id) {
		return timers.containsKey(id);
	}
	/**
	 * Returns remaining throttle period or null if the action may run now.
	 */
	Duration throttled(int id, ActionStats stats, long now) {
		Duration period = throttles.get(id);
		if (period == null || stats.runCount() == 0)
			return null;
		Duration since = Duration.ofNanos(now - stats.lastRunTimestamp());
		return since.compareTo(period) < 0 ? period.minus(since) : null;
	}
	void recorded(int id, ActionStats stats) {
		if (!autoEnabled(id) || configured.containsKey(id) || automatic.containsKey(id))
			return;
		if (stats.runCount() <= config.autoDebounceMinRuns())
			return;
		Duration average = stats.averageTime();
		if (average.compareTo(config.autoDebounceThreshold()) <= 0)
			return;
		Duration interval = average.multipliedBy(2);
		if (interval.compareTo(config.autoDebounceCap()) > 0)
			interval = config.autoDebounceCap();
		automatic.put(id, interval);
		logger.debug("Action {} averages {}ms per run, debouncing it by {}ms.", id, average.toMillis(), interval.toMillis());
	}
	void forget(int id) {
		cancel(id);
		configured.remove(id);
		automatic.remove(id);
		autoEnabled.remove(id);
		throttles.remove(id);
	}
}
