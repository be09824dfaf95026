package org.javai.diary.actions.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shape of a query result and the chosen rendering.
 *
 * @param visualizationType chosen rendering
 * @param columnCount number of columns
 * @param rowCount number of rows returned
 * @param columns column names in select-list order
 * @param columnTypes column name to type ({@code number}, {@code string}, {@code boolean}, {@code date}, {@code array}, {@code object})
 */
public record VisualizationMetadata(
		@JsonProperty("visualizationType") VisualizationType visualizationType,
		@JsonProperty("columnCount") int columnCount,
		@JsonProperty("rowCount") int rowCount,
		@JsonProperty("columns") List<String> columns,
		@JsonProperty("columnTypes") Map<String, String> columnTypes
) {

	public VisualizationMetadata {
		Objects.requireNonNull(visualizationType, "visualizationType must not be null");
		columns = columns != null ? List.copyOf(columns) : List.of();
		columnTypes = columnTypes != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes))
				: Map.of();
	}
}
