package org.javai.diary.actions.query;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.diary.actions.api.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

/**
 * Read path: question to SQL, SQL through the allow-list, then rows and a rendering.
 *
 * <p>The store is never called with SQL the guard rejected.</p>
 */
public class QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

	public static final int DEFAULT_MAX_ROWS = 1000;

	private final SqlGenerator generator;
	private final AnalyticsStore store;
	private final SqlGuard guard;
	private final VisualizationPlanner planner;
	private final int maxRows;

	public QueryExecutor(SqlGenerator generator, AnalyticsStore store) {
		this(generator, store, new SqlGuard(), new VisualizationPlanner(), DEFAULT_MAX_ROWS);
	}

	public QueryExecutor(SqlGenerator generator, AnalyticsStore store, SqlGuard guard,
			VisualizationPlanner planner, int maxRows) {
		this.generator = Objects.requireNonNull(generator, "generator must not be null");
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.guard = guard != null ? guard : new SqlGuard();
		this.planner = planner != null ? planner : new VisualizationPlanner();
		if (maxRows <= 0) {
			throw new IllegalArgumentException("maxRows must be positive, got: " + maxRows);
		}
		this.maxRows = maxRows;
	}

	/**
	 * @throws GenerationException if no SQL could be generated
	 * @throws QueryValidationException if the generated SQL is not an allowed read-only query
	 */
	public QueryResult execute(@NonNull String text, @NonNull Workspace workspace) {
		SqlGeneration generation = generator.generate(text, workspace);
		SqlStatement statement;
		try {
			statement = guard.check(generation.sql());
		}
		catch (QueryValidationException ex) {
			logger.warn("Rejected generated SQL: {} ({})", generation.sql(), ex.getMessage());
			throw ex;
		}

		List<Map<String, Object>> rows = store.select(statement);
		List<Map<String, Object>> safeRows = rows != null ? rows : List.of();
		boolean truncated = safeRows.size() > maxRows;
		if (truncated) {
			logger.debug("Truncating {} rows to {}", safeRows.size(), maxRows);
			safeRows = safeRows.subList(0, maxRows);
		}
		VisualizationMetadata metadata = planner.plan(safeRows, generation.visualizationType());
		return new QueryResult(statement.sql(), generation.explanation(), safeRows, metadata, truncated);
	}
}
