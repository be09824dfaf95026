package org.javai.diary.actions.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Answer to an analytics question.
 *
 * @param sql the SQL that was run
 * @param explanation the oracle's description of the query
 * @param rows result rows, columns in select-list order
 * @param metadata result shape and rendering
 * @param truncated true when more rows were returned than the configured maximum
 */
public record QueryResult(
		@JsonProperty("sql") String sql,
		@JsonProperty("explanation") String explanation,
		@JsonProperty("data") List<Map<String, Object>> rows,
		@JsonProperty("metadata") VisualizationMetadata metadata,
		@JsonProperty("truncated") boolean truncated
) {

	public QueryResult {
		Objects.requireNonNull(sql, "sql must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
		explanation = explanation != null ? explanation : "";
		rows = copyRows(rows);
	}

	// rows may legitimately hold null cells, so Map.copyOf is not usable here
	private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
		if (rows == null || rows.isEmpty()) {
			return List.of();
		}
		List<Map<String, Object>> copy = new ArrayList<>(rows.size());
		for (Map<String, Object> row : rows) {
			copy.add(row != null ? Collections.unmodifiableMap(new LinkedHashMap<>(row)) : Map.of());
		}
		return Collections.unmodifiableList(copy);
	}

	public int rowCount() {
		return rows.size();
	}
}
