package org.javai.diary.actions.exec;

import java.util.List;

/**
 * Counts over a batch's results; always consistent with them.
 */
public record ExecutionSummary(int total, int succeeded, int failed) {

	public ExecutionSummary {
		if (total < 0 || succeeded < 0 || failed < 0 || succeeded + failed != total) {
			throw new IllegalArgumentException(
					"Inconsistent summary: total=" + total + ", succeeded=" + succeeded + ", failed=" + failed);
		}
	}

	public static ExecutionSummary of(List<ExecutionResult> results) {
		if (results == null) {
			return new ExecutionSummary(0, 0, 0);
		}
		int succeeded = (int) results.stream().filter(ExecutionResult::success).count();
		return new ExecutionSummary(results.size(), succeeded, results.size() - succeeded);
	}
}
