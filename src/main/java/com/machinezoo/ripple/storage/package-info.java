// Part of Ripple
/*
 * Storage tiers are confined to the run-loop executor like the scheduler itself.
 * Everything arriving from the remote store is posted to the executor before it touches any tier.
 * Listeners are notified only when the value visible to readers changes.
 */
/**
 * Address and fact model, the three storage tiers, transactions, and the remote store boundary.
 */
package com.machinezoo.ripple.storage;
