package org.javai.diary.actions.resolve;

import java.util.Optional;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.MatchedEntry;

/**
 * Finds the catalog entry a free-text title most plausibly refers to.
 *
 * <p>Resolution is approximate by intent: a wrong suggestion is always shown to the user
 * before anything is executed. Implementations are pure functions of their arguments and
 * must resolve ties deterministically.</p>
 */
@FunctionalInterface
public interface EntityResolver {

	/**
	 * @param title the title the user (or oracle) referred to
	 * @param snapshot the catalog slice to search, newest first
	 * @return the best match, or empty when nothing qualifies
	 */
	Optional<MatchedEntry> resolve(String title, CatalogSnapshot snapshot);
}
