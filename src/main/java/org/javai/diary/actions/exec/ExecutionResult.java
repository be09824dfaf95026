package org.javai.diary.actions.exec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.javai.diary.actions.api.CatalogAction;

/**
 * Outcome of executing one action.
 *
 * @param action the action that was attempted
 * @param success whether the store applied it
 * @param error failure message, null on success
 * @param entryId the new entry's id for a create, the target id for an update or delete; null on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "action", "error", "entryId"})
public record ExecutionResult(CatalogAction action, boolean success, String error, String entryId) {

	public static ExecutionResult succeeded(CatalogAction action, String entryId) {
		return new ExecutionResult(action, true, null, entryId);
	}

	public static ExecutionResult failed(CatalogAction action, String error) {
		return new ExecutionResult(action, false, error != null ? error : "Unknown error occurred", null);
	}
}
