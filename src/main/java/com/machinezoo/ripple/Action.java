// Part of Ripple
package com.machinezoo.ripple;

import com.machinezoo.ripple.storage.*;

/**
 * Unit of reactive work. The scheduler runs it inside a {@link Transaction} that records what it reads and writes.
 * Action identity is object identity. Subscribing the same instance twice updates the existing subscription.
 */
@FunctionalInterface
public interface Action {
	void run(Transaction transaction);
}
