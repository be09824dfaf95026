package org.javai.diary.actions.confirm;

import java.util.Optional;
import org.javai.diary.actions.exec.BatchReport;

/**
 * Outcome of {@link ConfirmationSession#confirm}: either the batch ran, or nothing was executed
 * and {@code reason} says why.
 *
 * @param report execution report; null when nothing was executed
 * @param reason message for the user when nothing was executed; null otherwise
 */
public record ConfirmationResult(BatchReport report, String reason) {

	public static ConfirmationResult executed(BatchReport report) {
		if (report == null) {
			throw new IllegalArgumentException("report must not be null");
		}
		return new ConfirmationResult(report, null);
	}

	public static ConfirmationResult notExecuted(String reason) {
		return new ConfirmationResult(null, reason != null ? reason : "Nothing to execute");
	}

	public boolean wasExecuted() {
		return report != null;
	}

	public Optional<BatchReport> batchReport() {
		return Optional.ofNullable(report);
	}
}
