package org.javai.diary.actions.catalog;

import java.util.List;
import java.util.Optional;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.Workspace;

/**
 * The relational store holding the user's catalog rows.
 *
 * <p>Implementations scope every call to the current user; row isolation is the
 * store's concern, not the pipeline's. Mutations are single-row and last-write-wins;
 * no multi-statement transaction is exposed.</p>
 *
 * <p>All methods signal failure with {@link CatalogStoreException}.</p>
 */
public interface CatalogStore {

	/**
	 * Read the most recent entries of a workspace, newest first.
	 *
	 * @param workspace the workspace to read
	 * @param limit maximum number of rows to return
	 * @return a snapshot of at most {@code limit} rows
	 */
	CatalogSnapshot recent(Workspace workspace, int limit);

	Optional<CatalogEntry> findById(Workspace workspace, String id);

	/**
	 * Insert a new row.
	 *
	 * @return the stored row, including its assigned identifier
	 */
	CatalogEntry insert(Workspace workspace, ActionPayload fields);

	/**
	 * Apply {@code patch} to the row with the given id. Fields absent from the patch are left unchanged.
	 *
	 * @return the row after the update
	 */
	CatalogEntry update(Workspace workspace, String id, ActionPayload patch);

	void delete(Workspace workspace, String id);

	/**
	 * Every row of the workspace, newest first. Intended for small catalogs and tests.
	 */
	default List<CatalogEntry> all(Workspace workspace) {
		return recent(workspace, Integer.MAX_VALUE).entries();
	}
}
