package org.javai.diary.actions.generate;

import java.util.Objects;

/**
 * Result of asking the oracle for a batch of actions.
 */
public sealed interface GenerationResult permits GenerationResult.Success, GenerationResult.Failure {

	static GenerationResult success(GenerationOutput output) {
		return new Success(output);
	}

	static GenerationResult failure(String reason) {
		return new Failure(reason, null);
	}

	static GenerationResult failure(String reason, Throwable cause) {
		return new Failure(reason, cause);
	}

	record Success(GenerationOutput output) implements GenerationResult {
		public Success {
			Objects.requireNonNull(output, "output must not be null");
		}
	}

	/**
	 * The oracle was unreachable or answered with something that is not a usable batch.
	 *
	 * @param reason message suitable for showing to the user
	 * @param cause underlying exception, if any
	 */
	record Failure(String reason, Throwable cause) implements GenerationResult {
		public Failure {
			reason = reason != null ? reason : "Action generation failed";
		}
	}
}
