package org.javai.diary.actions.catalog;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.diary.actions.api.Workspace;

/**
 * Point-in-time, newest-first copy of the most recent catalog entries of one workspace.
 *
 * <p>The resolver and validator receive a snapshot as an argument; they never read the
 * catalog themselves. A snapshot is not refreshed: edits made elsewhere after it was
 * taken are not visible.</p>
 *
 * @param workspace the workspace the entries belong to
 * @param entries entries ordered newest first
 */
public record CatalogSnapshot(Workspace workspace, List<CatalogEntry> entries) {

	public static final int DEFAULT_WINDOW = 500;

	public CatalogSnapshot {
		Objects.requireNonNull(workspace, "workspace must not be null");
		entries = entries != null ? List.copyOf(entries) : List.of();
	}

	public static CatalogSnapshot empty(Workspace workspace) {
		return new CatalogSnapshot(workspace, List.of());
	}

	/**
	 * Build a snapshot from rows in any order: sorts newest first and keeps at most {@code window} rows.
	 */
	public static CatalogSnapshot of(Workspace workspace, List<CatalogEntry> rows, int window) {
		if (window <= 0) {
			throw new IllegalArgumentException("window must be positive, got: " + window);
		}
		List<CatalogEntry> ordered = (rows != null ? rows : List.<CatalogEntry>of()).stream()
				.filter(entry -> entry.workspace() == workspace)
				.sorted(Comparator.comparing(CatalogEntry::createdAt).reversed())
				.limit(window)
				.toList();
		return new CatalogSnapshot(workspace, ordered);
	}

	public Optional<CatalogEntry> findById(String id) {
		if (id == null) {
			return Optional.empty();
		}
		return entries.stream().filter(entry -> entry.id().equals(id)).findFirst();
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}
}
