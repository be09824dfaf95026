package org.javai.diary.actions.catalog;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.diary.actions.api.ActionFields;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.Workspace;

/**
 * A row of the user's catalog as read from the store.
 *
 * @param id store-assigned identifier
 * @param workspace the workspace the row belongs to
 * @param fields column values (sparse)
 * @param createdAt creation time; snapshots order by this, newest first
 */
public record CatalogEntry(String id, Workspace workspace, ActionPayload fields, Instant createdAt) {

	public CatalogEntry {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(workspace, "workspace must not be null");
		fields = fields != null ? fields : ActionPayload.empty();
		createdAt = createdAt != null ? createdAt : Instant.EPOCH;
	}

	public static CatalogEntry of(String id, Workspace workspace, Map<String, ?> fields, Instant createdAt) {
		return new CatalogEntry(id, workspace, ActionPayload.of(fields), createdAt);
	}

	/**
	 * @return the workspace title ({@code title} or {@code name}); empty string when absent
	 */
	public String title() {
		return fields.text(workspace.titleField()).orElse("");
	}

	public Optional<String> status() {
		return fields.text(ActionFields.STATUS);
	}

	public MatchedEntry toMatch() {
		return new MatchedEntry(id, title(), status().orElse(null));
	}
}
