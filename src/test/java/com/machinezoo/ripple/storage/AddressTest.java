// Part of Ripple
package com.machinezoo.ripple.storage;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;

public class AddressTest {
	@Test
	public void overlaps() {
		Address root = Address.of("s", "e");
		Address count = Address.of("s", "e", "count");
		Address nested = Address.of("s", "e", "count", "value");
		Address sibling = Address.of("s", "e", "total");
		// Prefix in either direction overlaps.
		assertTrue(root.overlaps(count));
		assertTrue(count.overlaps(root));
		assertTrue(nested.overlaps(count));
		assertTrue(count.overlaps(count));
		// Siblings do not overlap.
		assertFalse(count.overlaps(sibling));
		assertFalse(nested.overlaps(sibling));
		// Different entity or space never overlaps.
		assertFalse(count.overlaps(Address.of("s", "other", "count")));
		assertFalse(count.overlaps(Address.of("t", "e", "count")));
	}
	@Test
	public void value() {
		assertEquals(Address.of("s", "e", "a", "b"), Address.of("s", "e", "a").child("b"));
		assertEquals(Address.of("s", "e", "a").hashCode(), Address.of("s", "e", "a").hashCode());
		assertNotEquals(Address.of("s", "e", "a"), Address.of("s", "e", "b"));
		assertEquals(new EntityKey("s", "e"), Address.of("s", "e", "a").key());
		assertEquals("s/e/a/b", Address.of("s", "e", "a", "b").toString());
	}
}
