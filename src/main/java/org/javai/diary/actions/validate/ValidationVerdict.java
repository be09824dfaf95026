package org.javai.diary.actions.validate;

import java.util.List;

/**
 * Outcome of validating one action. Errors block execution; warnings are advisory.
 *
 * @param valid true exactly when there are no errors
 * @param errors blocking messages, in rule order
 * @param warnings advisory messages, in rule order
 */
public record ValidationVerdict(boolean valid, List<String> errors, List<String> warnings) {

	public ValidationVerdict {
		errors = errors != null ? List.copyOf(errors) : List.of();
		warnings = warnings != null ? List.copyOf(warnings) : List.of();
		if (valid != errors.isEmpty()) {
			throw new IllegalArgumentException("valid must be true exactly when errors is empty");
		}
	}

	public static ValidationVerdict of(List<String> errors, List<String> warnings) {
		return new ValidationVerdict(errors == null || errors.isEmpty(), errors, warnings);
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}
}
