// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.concurrent.*;

/*
 * Run-loop whose tasks run only when the test drains it, always on the test thread.
 * Tasks may be submitted from other threads, for example by debounce timers.
 */
public class TestLoop implements Executor {
	private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
	@Override
	public void execute(Runnable command) {
		queue.add(Objects.requireNonNull(command));
	}
	public int size() {
		return queue.size();
	}
	public boolean step() {
		Runnable task = queue.poll();
		if (task == null)
			return false;
		task.run();
		return true;
	}
	public int drain() {
		int count = 0;
		while (step()) {
			++count;
			if (count > 100_000)
				throw new IllegalStateException("Run-loop does not settle.");
		}
		return count;
	}
}
