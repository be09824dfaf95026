package org.javai.diary.actions.exec;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.generate.RawAction;

/**
 * Request body of the execute-actions endpoint.
 *
 * <p>Actions are kept raw so that an item with an unknown type fails on its own instead of
 * rejecting the whole request.</p>
 *
 * @param workspace target workspace; media when the body does not name one
 * @param actions the approved actions, in execution order
 */
public record ExecuteActionsRequest(
		@JsonProperty("workspace") Workspace workspace,
		@JsonProperty("actions") List<RawAction> actions
) {

	public ExecuteActionsRequest {
		workspace = workspace != null ? workspace : Workspace.MEDIA;
		Objects.requireNonNull(actions, "actions must not be null");
		actions = List.copyOf(actions);
	}
}
