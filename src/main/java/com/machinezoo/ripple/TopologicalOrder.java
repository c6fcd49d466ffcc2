// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.function.IntUnaryOperator;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Kahn's algorithm over the subgraph induced by the given actions.
 * Edges come from the dependency tracker and from parent/child relations, parents running first.
 *
 * When every remaining action has incoming edges, the graph contains a cycle.
 * The action with the lowest remaining in-degree is then taken next, which guarantees progress.
 * Ties are resolved by input order, so that the result is deterministic.
 */
final class TopologicalOrder {
	private TopologicalOrder() {
	}
	static IntList sort(IntCollection actions, DependencyTracker tracker, IntUnaryOperator parents) {
		Objects.requireNonNull(tracker);
		IntList remaining = new IntArrayList(new IntLinkedOpenHashSet(actions));
		Int2IntMap degrees = new Int2IntOpenHashMap();
		for (int target : remaining) {
			int degree = 0;
			for (int source : remaining)
				if (edge(source, target, tracker, parents))
					++degree;
			degrees.put(target, degree);
		}
		IntList order = new IntArrayList(remaining.size());
		while (!remaining.isEmpty()) {
			int best = 0;
			for (int i = 1; i < remaining.size() && degrees.get(remaining.getInt(best)) > 0; ++i)
				if (degrees.get(remaining.getInt(i)) < degrees.get(remaining.getInt(best)))
					best = i;
			int next = remaining.removeInt(best);
			order.add(next);
			for (int target : remaining)
				if (edge(next, target, tracker, parents))
					degrees.put(target, degrees.get(target) - 1);
		}
		return order;
	}
	private static boolean edge(int source, int target, DependencyTracker tracker, IntUnaryOperator parents) {
		if (source == target)
			return false;
		return tracker.feeds(source, target) || parents.applyAsInt(target) == source;
	}
}
