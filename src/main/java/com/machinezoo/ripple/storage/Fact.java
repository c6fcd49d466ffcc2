// Part of Ripple
package com.machinezoo.ripple.storage;

import java.nio.charset.*;
import java.util.*;
import com.google.common.hash.*;
import com.machinezoo.stagean.*;

/*
 * Facts are never mutated. A change to an entity produces a new fact whose cause points to the fact it supersedes.
 * Identity is derived from content, so two clients that produce the same fact on top of the same cause agree on its reference.
 *
 * Values are JSON-like trees. Maps and lists are copied into unmodifiable collections by ValuePaths before they get here,
 * so that the hash computed at construction stays valid for the lifetime of the fact.
 */
/**
 * Immutable, causally linked assertion of an entity's value.
 * Null value means the entity was retracted.
 */
@DraftDocs("document canonical rendering used for hashing")
public final class Fact {
	public static final String DEFAULT_TYPE = "application/json";
	private final String type;
	public String type() {
		return type;
	}
	private final String entity;
	public String entity() {
		return entity;
	}
	private final Object value;
	public Object value() {
		return value;
	}
	private final FactReference cause;
	/**
	 * Reference to the fact this fact supersedes.
	 *
	 * @return reference to the previous fact or {@code null} if this is the first fact for the entity
	 */
	public FactReference cause() {
		return cause;
	}
	private final FactReference reference;
	public FactReference reference() {
		return reference;
	}
	public Fact(String type, String entity, Object value, FactReference cause) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(entity);
		this.type = type;
		this.entity = entity;
		this.value = value;
		this.cause = cause;
		StringBuilder canonical = new StringBuilder();
		canonical.append(type).append('\n').append(entity).append('\n');
		render(canonical, value);
		canonical.append('\n').append(cause != null ? cause.hash() : "");
		reference = new FactReference(Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString());
	}
	public Fact(String entity, Object value, FactReference cause) {
		this(DEFAULT_TYPE, entity, value, cause);
	}
	/**
	 * Creates a fact that supersedes this one.
	 *
	 * @param value
	 *            new entity value
	 * @return new fact with {@link #cause()} pointing to this fact
	 */
	public Fact next(Object value) {
		return new Fact(type, entity, value, reference);
	}
	public boolean retracted() {
		return value == null;
	}
	/*
	 * Map keys are sorted, so that insertion order does not affect identity.
	 */
	private static void render(StringBuilder builder, Object value) {
		if (value == null)
			builder.append("null");
		else if (value instanceof String) {
			builder.append('"');
			String text = (String)value;
			for (int i = 0; i < text.length(); ++i) {
				char c = text.charAt(i);
				if (c == '"' || c == '\\')
					builder.append('\\');
				builder.append(c);
			}
			builder.append('"');
		} else if (value instanceof Number || value instanceof Boolean)
			builder.append(value);
		else if (value instanceof Map) {
			Map<String, Object> sorted = new TreeMap<>();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet())
				sorted.put(String.valueOf(entry.getKey()), entry.getValue());
			builder.append('{');
			boolean first = true;
			for (Map.Entry<String, Object> entry : sorted.entrySet()) {
				if (!first)
					builder.append(',');
				first = false;
				render(builder, entry.getKey());
				builder.append(':');
				render(builder, entry.getValue());
			}
			builder.append('}');
		} else if (value instanceof List) {
			builder.append('[');
			boolean first = true;
			for (Object item : (List<?>)value) {
				if (!first)
					builder.append(',');
				first = false;
				render(builder, item);
			}
			builder.append(']');
		} else
			throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof Fact && reference.equals(((Fact)obj).reference);
	}
	@Override
	public int hashCode() {
		return reference.hashCode();
	}
	@Override
	public String toString() {
		return "fact " + reference + " of " + entity + (cause != null ? " after " + cause : "");
	}
}
