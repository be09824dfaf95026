package org.javai.diary.actions.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The text-to-SQL oracle's answer.
 *
 * @param sql generated SQL, not yet checked
 * @param explanation human-readable description of what the query computes
 * @param visualizationType optional chart hint ({@code kpi}, {@code table}, {@code bar}, {@code pie}, {@code line}, {@code area})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SqlGeneration(
		@JsonProperty("sql") String sql,
		@JsonProperty("explanation") String explanation,
		@JsonProperty("visualizationType") String visualizationType
) {

	public SqlGeneration(String sql, String explanation) {
		this(sql, explanation, null);
	}
}
