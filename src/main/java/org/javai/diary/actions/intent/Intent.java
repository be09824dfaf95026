package org.javai.diary.actions.intent;

/**
 * Routing decision for a free-text request.
 */
public enum Intent {
	/** Read-only analytics over the catalog. */
	QUERY,
	/** A mutation of the catalog that must be confirmed before it runs. */
	ACTION
}
