package org.javai.diary.actions;

/**
 * Thrown when assistant configuration cannot be read or holds an invalid value.
 */
public class AssistantConfigException extends RuntimeException {

	public AssistantConfigException(String message) {
		super(message);
	}

	public AssistantConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
