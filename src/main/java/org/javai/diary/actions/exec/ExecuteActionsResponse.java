package org.javai.diary.actions.exec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import org.javai.diary.actions.generate.RawAction;

/**
 * Response body of the execute-actions endpoint.
 *
 * <p>Each result echoes the action exactly as it was submitted.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "results", "summary", "error"})
public record ExecuteActionsResponse(boolean success, List<Result> results, ExecutionSummary summary, String error) {

	public static ExecuteActionsResponse completed(List<Result> results) {
		List<Result> safe = results != null ? List.copyOf(results) : List.of();
		int succeeded = (int) safe.stream().filter(Result::success).count();
		ExecutionSummary summary = new ExecutionSummary(safe.size(), succeeded, safe.size() - succeeded);
		return new ExecuteActionsResponse(summary.failed() == 0, safe, summary, null);
	}

	public static ExecuteActionsResponse error(String message) {
		return new ExecuteActionsResponse(false, null, null, message);
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"success", "action", "error", "entryId"})
	public record Result(boolean success, RawAction action, String error, String entryId) {

		static Result of(RawAction submitted, ExecutionResult executed) {
			return new Result(executed.success(), submitted, executed.error(), executed.entryId());
		}

		static Result failed(RawAction submitted, String error) {
			return new Result(false, submitted, error, null);
		}
	}
}
