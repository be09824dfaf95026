package org.javai.diary.actions.resolve;

import java.util.Optional;
import org.javai.diary.actions.catalog.CatalogEntry;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.MatchedEntry;

/**
 * Returns the first entry, in snapshot (newest-first) order, whose normalized title equals
 * the query or where one contains the other. No ranking among qualifying entries.
 */
public final class RecencyEntityResolver implements EntityResolver {

	@Override
	public Optional<MatchedEntry> resolve(String title, CatalogSnapshot snapshot) {
		String query = TitleNormalizer.normalize(title);
		if (query.isEmpty() || snapshot == null) {
			return Optional.empty();
		}
		for (CatalogEntry entry : snapshot.entries()) {
			if (TitleNormalizer.qualifies(TitleNormalizer.normalize(entry.title()), query)) {
				return Optional.of(entry.toMatch());
			}
		}
		return Optional.empty();
	}
}
