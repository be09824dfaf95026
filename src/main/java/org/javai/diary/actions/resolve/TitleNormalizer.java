package org.javai.diary.actions.resolve;

import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes titles for approximate comparison: trims, lower-cases and collapses internal whitespace.
 */
public final class TitleNormalizer {

	private TitleNormalizer() {
	}

	public static String normalize(String title) {
		if (title == null) {
			return "";
		}
		return StringUtils.normalizeSpace(title).toLowerCase(Locale.ROOT);
	}

	/**
	 * Two normalized titles qualify as a match when equal or when either contains the other.
	 * Blank titles never match.
	 */
	public static boolean qualifies(String normalizedCandidate, String normalizedQuery) {
		if (normalizedCandidate.isEmpty() || normalizedQuery.isEmpty()) {
			return false;
		}
		return normalizedCandidate.equals(normalizedQuery)
				|| normalizedCandidate.contains(normalizedQuery)
				|| normalizedQuery.contains(normalizedCandidate);
	}
}
