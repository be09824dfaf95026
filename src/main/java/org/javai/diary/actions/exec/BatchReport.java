package org.javai.diary.actions.exec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Per-action results of a batch, in submission order, plus the derived summary.
 */
@JsonPropertyOrder({"success", "results", "summary"})
public record BatchReport(List<ExecutionResult> results, ExecutionSummary summary) {

	public BatchReport {
		results = results != null ? List.copyOf(results) : List.of();
		summary = ExecutionSummary.of(results);
	}

	public static BatchReport of(List<ExecutionResult> results) {
		return new BatchReport(results, null);
	}

	/**
	 * @return true when no action failed
	 */
	@JsonProperty("success")
	public boolean success() {
		return summary.failed() == 0;
	}
}
