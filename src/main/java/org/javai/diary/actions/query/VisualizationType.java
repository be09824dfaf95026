package org.javai.diary.actions.query;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * How a query result should be rendered.
 */
public enum VisualizationType {
	KPI("kpi", 1),
	TABLE("table", 0),
	BAR("bar", 2),
	PIE("pie", 2),
	LINE("line", 2),
	AREA("area", 2);

	private final String wireValue;
	private final int minColumns;

	VisualizationType(String wireValue, int minColumns) {
		this.wireValue = wireValue;
		this.minColumns = minColumns;
	}

	@JsonValue
	public String wireValue() {
		return wireValue;
	}

	/**
	 * @return the smallest number of columns a result needs for this rendering
	 */
	public int minColumns() {
		return minColumns;
	}

	public static Optional<VisualizationType> fromWireValue(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (VisualizationType type : values()) {
			if (type.wireValue.equals(normalized)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
