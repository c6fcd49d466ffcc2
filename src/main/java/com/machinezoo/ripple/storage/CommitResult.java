// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import com.google.common.collect.*;

/**
 * Outcome of a commit: either confirmed revisions or a conflict.
 * Conflicts are values, not exceptions. Transport failures are reported by completing the commit future exceptionally.
 */
public final class CommitResult {
	/**
	 * CAS mismatch on one entity.
	 */
	public static final class Conflict {
		private final EntityKey key;
		public EntityKey key() {
			return key;
		}
		private final FactReference expected;
		/**
		 * Cause the rejected write was built on.
		 *
		 * @return expected reference or {@code null} if the writer expected the entity to be absent
		 */
		public FactReference expected() {
			return expected;
		}
		private final Revision actual;
		/**
		 * Current state of the entity where the conflict was detected.
		 *
		 * @return confirmed revision or {@code null} if the entity is absent or the conflict was detected locally
		 */
		public Revision actual() {
			return actual;
		}
		public Conflict(EntityKey key, FactReference expected, Revision actual) {
			Objects.requireNonNull(key);
			this.key = key;
			this.expected = expected;
			this.actual = actual;
		}
		@Override
		public String toString() {
			return "conflict on " + key + ": expected " + expected + ", found " + (actual != null ? actual.fact().reference() : null);
		}
	}
	private final List<Revision> revisions;
	public List<Revision> revisions() {
		return revisions;
	}
	private final Conflict conflict;
	public Conflict conflict() {
		return conflict;
	}
	private CommitResult(List<Revision> revisions, Conflict conflict) {
		this.revisions = revisions;
		this.conflict = conflict;
	}
	public static CommitResult success(List<Revision> revisions) {
		return new CommitResult(ImmutableList.copyOf(revisions), null);
	}
	public static CommitResult rejected(Conflict conflict) {
		Objects.requireNonNull(conflict);
		return new CommitResult(Collections.emptyList(), conflict);
	}
	public boolean ok() {
		return conflict == null;
	}
	@Override
	public String toString() {
		return ok() ? "committed " + revisions.size() + " facts" : conflict.toString();
	}
}
