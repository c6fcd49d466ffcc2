// Part of Ripple
package com.machinezoo.ripple.storage;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Entity values are JSON-like trees of maps, lists, strings, numbers, and booleans.
 * Updates never mutate the tree. They copy every map and list on the path and share the rest.
 */
/**
 * Reads and copy-on-write updates of entity values at an address path.
 */
@StubDocs
public class ValuePaths {
	/**
	 * Reads value at the given path.
	 *
	 * @param root
	 *            entity value
	 * @param path
	 *            property steps, list elements addressed by decimal index
	 * @return value at the path or {@code null} if any step is missing
	 */
	public static Object get(Object root, List<String> path) {
		Objects.requireNonNull(path);
		Object current = root;
		for (String step : path) {
			if (current instanceof Map)
				current = ((Map<?, ?>)current).get(step);
			else if (current instanceof List) {
				List<?> list = (List<?>)current;
				int index = index(step);
				current = index >= 0 && index < list.size() ? list.get(index) : null;
			} else
				return null;
		}
		return current;
	}
	/**
	 * Returns new value tree with the value at the given path replaced.
	 * Missing intermediate objects are created as maps.
	 *
	 * @param root
	 *            entity value, not modified
	 * @param path
	 *            property steps
	 * @param value
	 *            value to store, {@code null} removes map properties
	 * @return updated copy of the tree
	 */
	public static Object set(Object root, List<String> path, Object value) {
		Objects.requireNonNull(path);
		return set(root, path, 0, freeze(value));
	}
	private static Object set(Object node, List<String> path, int depth, Object value) {
		if (depth == path.size())
			return value;
		String step = path.get(depth);
		if (node instanceof List) {
			int index = index(step);
			List<?> original = (List<?>)node;
			if (index < 0 || index > original.size())
				throw new IllegalArgumentException("List index out of range: " + step);
			List<Object> copy = new ArrayList<>(original);
			Object child = index < copy.size() ? copy.get(index) : null;
			Object updated = set(child, path, depth + 1, value);
			if (index < copy.size())
				copy.set(index, updated);
			else
				copy.add(updated);
			return Collections.unmodifiableList(copy);
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		if (node instanceof Map)
			for (Map.Entry<?, ?> entry : ((Map<?, ?>)node).entrySet())
				copy.put(String.valueOf(entry.getKey()), entry.getValue());
		Object updated = set(copy.get(step), path, depth + 1, value);
		if (updated == null)
			copy.remove(step);
		else
			copy.put(step, updated);
		return Collections.unmodifiableMap(copy);
	}
	/**
	 * Makes a deep unmodifiable copy of maps and lists in the value.
	 *
	 * @param value
	 *            value supplied by application code
	 * @return value safe to embed in a {@link Fact}
	 * @throws IllegalArgumentException
	 *             if the value contains anything other than maps, lists, strings, numbers, booleans, and nulls
	 */
	public static Object freeze(Object value) {
		if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean)
			return value;
		if (value instanceof Map) {
			Map<String, Object> copy = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet())
				copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
			return Collections.unmodifiableMap(copy);
		}
		if (value instanceof List) {
			List<Object> copy = new ArrayList<>();
			for (Object item : (List<?>)value)
				copy.add(freeze(item));
			return Collections.unmodifiableList(copy);
		}
		throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
	}
	/*
	 * Every list element has exactly one spelling. Otherwise "7" and "007" would be different addresses
	 * of the same element and a write through one would not trigger readers of the other.
	 */
	private static int index(String step) {
		if (step.isEmpty() || step.length() > 9)
			return -1;
		if (step.length() > 1 && step.charAt(0) == '0')
			return -1;
		for (int i = 0; i < step.length(); ++i)
			if (step.charAt(i) < '0' || step.charAt(i) > '9')
				return -1;
		return Integer.parseInt(step);
	}
}
