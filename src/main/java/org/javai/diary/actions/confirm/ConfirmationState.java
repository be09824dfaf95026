package org.javai.diary.actions.confirm;

/**
 * Lifecycle of a confirmation session. Only an {@code OPEN} session accepts changes.
 */
public enum ConfirmationState {
	OPEN,
	CONFIRMED,
	CANCELLED;

	public boolean isTerminal() {
		return this != OPEN;
	}
}
