package org.javai.diary.actions.resolve;

import java.util.List;
import java.util.Optional;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.javai.diary.actions.catalog.CatalogEntry;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.MatchedEntry;

/**
 * Ranks qualifying entries instead of taking the first one.
 *
 * <ol>
 *   <li>An exact (normalized) title match wins outright.</li>
 *   <li>Otherwise, among substring matches, the smallest Levenshtein distance between the
 *       normalized titles wins.</li>
 *   <li>Ties go to the entry that comes first in the snapshot, i.e. the most recent one.</li>
 * </ol>
 *
 * <p>Querying "Batman" against a catalog holding "The Batman 2" (newer) and "Batman" (older)
 * resolves to "Batman".</p>
 */
public final class RankedEntityResolver implements EntityResolver {

	private static final LevenshteinDistance DISTANCE = LevenshteinDistance.getDefaultInstance();

	@Override
	public Optional<MatchedEntry> resolve(String title, CatalogSnapshot snapshot) {
		String query = TitleNormalizer.normalize(title);
		if (query.isEmpty() || snapshot == null) {
			return Optional.empty();
		}

		List<CatalogEntry> entries = snapshot.entries();
		CatalogEntry best = null;
		int bestDistance = Integer.MAX_VALUE;
		for (CatalogEntry entry : entries) {
			String candidate = TitleNormalizer.normalize(entry.title());
			if (!TitleNormalizer.qualifies(candidate, query)) {
				continue;
			}
			if (candidate.equals(query)) {
				return Optional.of(entry.toMatch());
			}
			int distance = DISTANCE.apply(candidate, query);
			// strict comparison keeps the earlier (newer) entry on ties
			if (distance < bestDistance) {
				best = entry;
				bestDistance = distance;
			}
		}
		return Optional.ofNullable(best).map(CatalogEntry::toMatch);
	}
}
