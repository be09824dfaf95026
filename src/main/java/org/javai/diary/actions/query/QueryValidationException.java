package org.javai.diary.actions.query;

/**
 * Thrown when generated SQL is rejected by the read-only allow-list.
 */
public class QueryValidationException extends RuntimeException {

	public QueryValidationException(String message) {
		super(message);
	}

	public QueryValidationException(String message, Throwable cause) {
		super(message, cause);
	}
}
