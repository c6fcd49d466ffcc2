// Part of Ripple
package com.machinezoo.ripple;

import java.time.*;
import java.util.concurrent.atomic.*;
import com.google.common.base.*;

public class ManualTicker extends Ticker {
	private final AtomicLong nanos = new AtomicLong();
	@Override
	public long read() {
		return nanos.get();
	}
	public void advance(Duration duration) {
		nanos.addAndGet(duration.toNanos());
	}
	public void advance(int millis) {
		advance(Duration.ofMillis(millis));
	}
}
