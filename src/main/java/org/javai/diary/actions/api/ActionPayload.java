package org.javai.diary.actions.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sparse, immutable mapping of payload field name to value.
 *
 * <p>Only fields the oracle (or the user) actually supplied are present. Null values
 * are dropped on construction, so {@link #has(String)} means "has a non-null value".
 * Insertion order is preserved so payloads render in the order they were produced.</p>
 */
public final class ActionPayload {

	private static final ActionPayload EMPTY = new ActionPayload(Map.of());

	private final Map<String, Object> fields;

	private ActionPayload(Map<String, ?> fields) {
		Map<String, Object> copy = new LinkedHashMap<>();
		fields.forEach((key, value) -> {
			if (key != null && !key.isBlank() && value != null) {
				copy.put(key, value);
			}
		});
		this.fields = Collections.unmodifiableMap(copy);
	}

	public static ActionPayload empty() {
		return EMPTY;
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static ActionPayload of(Map<String, ?> fields) {
		if (fields == null || fields.isEmpty()) {
			return EMPTY;
		}
		return new ActionPayload(fields);
	}

	public boolean has(String field) {
		return fields.containsKey(field);
	}

	public Optional<Object> get(String field) {
		return Optional.ofNullable(fields.get(field));
	}

	/**
	 * Read a field as text. Non-string scalars are rendered with {@code toString()}.
	 */
	public Optional<String> text(String field) {
		return get(field).map(Object::toString);
	}

	/**
	 * Read a field as a number, if the stored value is numeric.
	 */
	public Optional<Number> number(String field) {
		return get(field).filter(Number.class::isInstance).map(Number.class::cast);
	}

	/**
	 * Return a payload with {@code patch} merged over this one.
	 * A {@code null} value in the patch removes the field.
	 */
	public ActionPayload merge(Map<String, ?> patch) {
		if (patch == null || patch.isEmpty()) {
			return this;
		}
		Map<String, Object> merged = new LinkedHashMap<>(fields);
		patch.forEach((key, value) -> {
			if (value == null) {
				merged.remove(key);
			}
			else {
				merged.put(key, value);
			}
		});
		return new ActionPayload(merged);
	}

	public boolean isEmpty() {
		return fields.isEmpty();
	}

	public int size() {
		return fields.size();
	}

	@JsonValue
	public Map<String, Object> asMap() {
		return fields;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ActionPayload other)) {
			return false;
		}
		return fields.equals(other.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fields);
	}

	@Override
	public String toString() {
		return fields.toString();
	}
}
