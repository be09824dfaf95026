package org.javai.diary.actions.query;

import java.util.List;
import java.util.Map;

/**
 * Read-only SQL access to the catalog.
 *
 * <p>Implementations only ever receive statements that passed {@link SqlGuard}. Each row is a
 * map from column name to value, with columns in select-list order. Store failures are reported
 * as {@link org.javai.diary.actions.catalog.CatalogStoreException}.</p>
 */
@FunctionalInterface
public interface AnalyticsStore {

	List<Map<String, Object>> select(SqlStatement statement);
}
