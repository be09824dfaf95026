package org.javai.diary.actions.catalog;

/**
 * Thrown by a {@link CatalogStore} when the store rejects a read or a mutation
 * (unknown row, constraint violation, connectivity failure).
 */
public class CatalogStoreException extends RuntimeException {

	public CatalogStoreException(String message) {
		super(message);
	}

	public CatalogStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
