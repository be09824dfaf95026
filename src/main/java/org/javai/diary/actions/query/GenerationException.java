package org.javai.diary.actions.query;

/**
 * Thrown when the text-to-SQL oracle is unreachable or answers with unusable output.
 */
public class GenerationException extends RuntimeException {

	public GenerationException(String message) {
		super(message);
	}

	public GenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
