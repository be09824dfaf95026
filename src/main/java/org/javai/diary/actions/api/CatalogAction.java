package org.javai.diary.actions.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A candidate create/update/delete mutation of the user's catalog.
 *
 * <p>Produced from oracle output, enriched with a {@code targetId} once the title has been
 * resolved against the catalog, optionally edited by the user, and consumed exactly once
 * by the batch executor. Instances are immutable; the {@code with*} methods return copies.</p>
 *
 * <p>Wire shape:</p>
 * <pre>
 * { "type": "update", "id": "e-42", "data": { "title": "Inception", "status": "Finished", "my_rating": 9 } }
 * </pre>
 *
 * @param kind the mutation kind
 * @param targetId identifier of the existing entry (update/delete, after resolution); may be null
 * @param payload sparse field values
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogAction(
		@JsonProperty("type") @JsonAlias("kind") ActionKind kind,
		@JsonProperty("id") @JsonAlias("targetId") String targetId,
		@JsonProperty("data") @JsonAlias("payload") ActionPayload payload
) {

	public CatalogAction {
		Objects.requireNonNull(kind, "kind must not be null");
		payload = payload != null ? payload : ActionPayload.empty();
		targetId = targetId != null && !targetId.isBlank() ? targetId : null;
	}

	public static CatalogAction create(Map<String, ?> fields) {
		return new CatalogAction(ActionKind.CREATE, null, ActionPayload.of(fields));
	}

	public static CatalogAction update(Map<String, ?> fields) {
		return new CatalogAction(ActionKind.UPDATE, null, ActionPayload.of(fields));
	}

	public static CatalogAction delete(Map<String, ?> fields) {
		return new CatalogAction(ActionKind.DELETE, null, ActionPayload.of(fields));
	}

	/**
	 * The value of the workspace's title field, if present.
	 */
	public Optional<String> title(Workspace workspace) {
		return payload.text(workspace.titleField());
	}

	@JsonIgnore
	public Optional<String> target() {
		return Optional.ofNullable(targetId);
	}

	public CatalogAction withTargetId(String id) {
		return new CatalogAction(kind, id, payload);
	}

	public CatalogAction withPayload(ActionPayload newPayload) {
		return new CatalogAction(kind, targetId, newPayload);
	}

	/**
	 * Merge {@code patch} into the payload; {@code null} patch values remove fields.
	 */
	public CatalogAction withPatch(Map<String, ?> patch) {
		return withPayload(payload.merge(patch));
	}
}
