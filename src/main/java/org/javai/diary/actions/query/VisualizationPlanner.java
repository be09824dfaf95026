package org.javai.diary.actions.query;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Chooses a rendering for a query result from its shape.
 *
 * <ul>
 *   <li>a single numeric cell is a {@code kpi}</li>
 *   <li>a date column followed by a numeric column is a {@code line}</li>
 *   <li>a label column followed by a numeric column is a {@code pie} up to {@value #MAX_PIE_SLICES} rows,
 *       a {@code bar} beyond</li>
 *   <li>anything else, including an empty result, is a {@code table}</li>
 * </ul>
 *
 * <p>An oracle hint wins when it names a known type and the result has enough columns for it.</p>
 */
public class VisualizationPlanner {

	static final int MAX_PIE_SLICES = 6;

	static final String NUMBER = "number";
	static final String STRING = "string";
	static final String BOOLEAN = "boolean";
	static final String DATE = "date";
	static final String ARRAY = "array";
	static final String OBJECT = "object";

	private static final Pattern ISO_DATE_TEXT = Pattern.compile("^\\d{4}-\\d{2}(-\\d{2})?([T ].*)?$");

	public VisualizationMetadata plan(List<Map<String, Object>> rows) {
		return plan(rows, null);
	}

	public VisualizationMetadata plan(List<Map<String, Object>> rows, String hint) {
		List<Map<String, Object>> safeRows = rows != null ? rows : List.of();
		List<String> columns = columns(safeRows);
		Map<String, String> columnTypes = new LinkedHashMap<>();
		for (String column : columns) {
			columnTypes.put(column, columnType(safeRows, column));
		}

		VisualizationType type = VisualizationType.fromWireValue(hint)
				.filter(hinted -> !safeRows.isEmpty() && columns.size() >= hinted.minColumns())
				.orElseGet(() -> infer(safeRows.size(), columns, columnTypes));
		return new VisualizationMetadata(type, columns.size(), safeRows.size(), columns, columnTypes);
	}

	private VisualizationType infer(int rowCount, List<String> columns, Map<String, String> types) {
		if (rowCount == 0 || columns.isEmpty()) {
			return VisualizationType.TABLE;
		}
		if (rowCount == 1 && columns.size() == 1 && NUMBER.equals(types.get(columns.get(0)))) {
			return VisualizationType.KPI;
		}
		if (columns.size() >= 2) {
			String first = types.get(columns.get(0));
			if (DATE.equals(first) && laterNumericColumn(columns, types)) {
				return VisualizationType.LINE;
			}
			if (STRING.equals(first) && NUMBER.equals(types.get(columns.get(1)))) {
				return rowCount <= MAX_PIE_SLICES ? VisualizationType.PIE : VisualizationType.BAR;
			}
		}
		return VisualizationType.TABLE;
	}

	private static boolean laterNumericColumn(List<String> columns, Map<String, String> types) {
		for (int i = 1; i < columns.size(); i++) {
			if (NUMBER.equals(types.get(columns.get(i)))) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Column names in first-row order, followed by any names only later rows carry.
	 */
	private static List<String> columns(List<Map<String, Object>> rows) {
		List<String> columns = new ArrayList<>();
		for (Map<String, Object> row : rows) {
			if (row == null) {
				continue;
			}
			for (String key : row.keySet()) {
				if (!columns.contains(key)) {
					columns.add(key);
				}
			}
		}
		return columns;
	}

	private static String columnType(List<Map<String, Object>> rows, String column) {
		for (Map<String, Object> row : rows) {
			Object value = row != null ? row.get(column) : null;
			if (value != null) {
				return typeOf(value);
			}
		}
		return STRING;
	}

	static String typeOf(Object value) {
		if (value instanceof Number) {
			return NUMBER;
		}
		if (value instanceof Boolean) {
			return BOOLEAN;
		}
		if (value instanceof TemporalAccessor || value instanceof Date) {
			return DATE;
		}
		if (value instanceof Collection<?> || value.getClass().isArray()) {
			return ARRAY;
		}
		if (value instanceof Map<?, ?>) {
			return OBJECT;
		}
		if (value instanceof CharSequence text && ISO_DATE_TEXT.matcher(text).matches()) {
			return DATE;
		}
		return STRING;
	}
}
