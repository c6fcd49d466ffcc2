// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;

/**
 * Receives changes of visible entity values from {@link TierManager}.
 * All changes caused by one tier operation are delivered in one call.
 */
@FunctionalInterface
public interface StorageListener {
	void changed(List<StorageChange> changes);
}
