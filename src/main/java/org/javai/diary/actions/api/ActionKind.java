package org.javai.diary.actions.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The kind of mutation a {@link CatalogAction} proposes.
 * CREATE - insert a new catalog entry from the payload.
 * UPDATE - patch an existing entry with the payload.
 * DELETE - remove an existing entry.
 */
public enum ActionKind {
	CREATE("create"),
	UPDATE("update"),
	DELETE("delete");

	private final String wireValue;

	ActionKind(String wireValue) {
		this.wireValue = wireValue;
	}

	@JsonValue
	public String wireValue() {
		return wireValue;
	}

	/**
	 * Whether this kind operates on an existing entry and therefore needs a resolved target.
	 */
	public boolean targetsExistingEntry() {
		return this != CREATE;
	}

	/**
	 * Parse the wire value ({@code create}, {@code update}, {@code delete}), case-insensitively.
	 *
	 * @throws IllegalArgumentException if the value is not a known kind
	 */
	@JsonCreator
	public static ActionKind fromWireValue(String value) {
		if (value == null) {
			throw new IllegalArgumentException("Action kind must not be null");
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (ActionKind kind : values()) {
			if (kind.wireValue.equals(normalized)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown action kind: " + value);
	}
}
