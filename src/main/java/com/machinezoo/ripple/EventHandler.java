// Part of Ripple
package com.machinezoo.ripple;

import com.machinezoo.ripple.storage.*;

/**
 * Receiver of events queued on an event stream address.
 * Handlers are how outside input, for example user interaction, turns into writes.
 * Unlike actions, handlers are not rerun when what they read changes.
 *
 * @see Scheduler#addEventHandler(Address, EventHandler)
 * @see Scheduler#queueEvent(Address, Object)
 */
@FunctionalInterface
public interface EventHandler {
	void handle(Transaction transaction, Object event);
	/**
	 * Reads what {@link #handle(Transaction, Object)} is going to read, without writing anything.
	 * In pull mode, dirty computations that might write any of these reads are brought up to date before the handler runs.
	 * Handlers that do not override this method run without waiting.
	 *
	 * @param transaction
	 *            transaction recording the reads, discarded afterwards
	 * @param event
	 *            event about to be handled
	 */
	default void dependencies(Transaction transaction, Object event) {
	}
}
