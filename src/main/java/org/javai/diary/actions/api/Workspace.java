package org.javai.diary.actions.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The data domain a request targets. Each workspace has its own catalog table,
 * its own title field and its own field enumerations.
 */
public enum Workspace {
	MEDIA("media", "media_entries", ActionFields.TITLE),
	FOOD("food", "food_entries", ActionFields.NAME);

	private final String wireValue;
	private final String tableName;
	private final String titleField;

	Workspace(String wireValue, String tableName, String titleField) {
		this.wireValue = wireValue;
		this.tableName = tableName;
		this.titleField = titleField;
	}

	@JsonValue
	public String wireValue() {
		return wireValue;
	}

	/**
	 * @return the catalog table backing this workspace
	 */
	public String tableName() {
		return tableName;
	}

	/**
	 * @return the payload field that names an entry ({@code title} for media, {@code name} for food)
	 */
	public String titleField() {
		return titleField;
	}

	@JsonCreator
	public static Workspace fromWireValue(String value) {
		if (value == null) {
			throw new IllegalArgumentException("Workspace must not be null");
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (Workspace workspace : values()) {
			if (workspace.wireValue.equals(normalized)) {
				return workspace;
			}
		}
		throw new IllegalArgumentException("Unknown workspace: " + value);
	}
}
