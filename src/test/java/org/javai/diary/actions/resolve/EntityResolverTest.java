package org.javai.diary.actions.resolve;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.catalog.CatalogEntry;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.MatchedEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Entity resolution")
class EntityResolverTest {

	/**
	 * Builds a snapshot whose entries are given newest first.
	 */
	private static CatalogSnapshot snapshot(String... titles) {
		List<CatalogEntry> entries = new ArrayList<>();
		Instant newest = Instant.parse("2024-06-01T00:00:00Z");
		for (int i = 0; i < titles.length; i++) {
			entries.add(CatalogEntry.of("media-" + (i + 1), Workspace.MEDIA,
					Map.of("title", titles[i], "status", "Finished"), newest.minusSeconds(i)));
		}
		return CatalogSnapshot.of(Workspace.MEDIA, entries, CatalogSnapshot.DEFAULT_WINDOW);
	}

	@Nested
	@DisplayName("TitleNormalizer")
	class Normalization {

		@Test
		@DisplayName("trims, lower-cases and collapses whitespace")
		void normalizes() {
			assertThat(TitleNormalizer.normalize("  The   Dark\tKnight ")).isEqualTo("the dark knight");
			assertThat(TitleNormalizer.normalize(null)).isEmpty();
		}

		@Test
		@DisplayName("blank titles never qualify")
		void blankNeverQualifies() {
			assertThat(TitleNormalizer.qualifies("", "dune")).isFalse();
			assertThat(TitleNormalizer.qualifies("dune", "")).isFalse();
		}
	}

	@Nested
	@DisplayName("RecencyEntityResolver")
	class Recency {

		private final EntityResolver resolver = new RecencyEntityResolver();

		@Test
		@DisplayName("matches case-insensitively and ignores surrounding whitespace")
		void caseInsensitive() {
			assertThat(resolver.resolve("  inCEPTion ", snapshot("Inception")))
					.map(MatchedEntry::id).contains("media-1");
		}

		@Test
		@DisplayName("matches when either title contains the other")
		void substringBothWays() {
			assertThat(resolver.resolve("Batman", snapshot("The Batman"))).isPresent();
			assertThat(resolver.resolve("The Batman Returns", snapshot("Batman"))).isPresent();
		}

		@Test
		@DisplayName("returns the newest qualifying entry")
		void newestWins() {
			Optional<MatchedEntry> match = resolver.resolve("Batman", snapshot("The Batman 2", "Batman"));

			assertThat(match).map(MatchedEntry::title).contains("The Batman 2");
		}

		@Test
		@DisplayName("misses on unrelated titles, blank queries and empty catalogs")
		void misses() {
			assertThat(resolver.resolve("Dune", snapshot("Inception"))).isEmpty();
			assertThat(resolver.resolve("   ", snapshot("Inception"))).isEmpty();
			assertThat(resolver.resolve("Dune", CatalogSnapshot.empty(Workspace.MEDIA))).isEmpty();
		}
	}

	@Nested
	@DisplayName("RankedEntityResolver")
	class Ranked {

		private final EntityResolver resolver = new RankedEntityResolver();

		@Test
		@DisplayName("prefers an older exact match over a newer substring match")
		void exactBeatsSubstring() {
			Optional<MatchedEntry> match = resolver.resolve("Batman", snapshot("The Batman 2", "Batman"));

			assertThat(match).map(MatchedEntry::id).contains("media-2");
		}

		@Test
		@DisplayName("prefers the closer of two substring matches")
		void closerSubstringWins() {
			Optional<MatchedEntry> match = resolver.resolve("Batman",
					snapshot("Batman: The Animated Series", "The Batman"));

			assertThat(match).map(MatchedEntry::title).contains("The Batman");
		}

		@Test
		@DisplayName("breaks distance ties by recency")
		void tieGoesToNewest() {
			Optional<MatchedEntry> match = resolver.resolve("Alien", snapshot("Aliens", "Alien3"));

			assertThat(match).map(MatchedEntry::id).contains("media-1");
		}

		@Test
		@DisplayName("returns the same answer on repeated calls")
		void deterministic() {
			CatalogSnapshot catalog = snapshot("Dune: Part Two", "Dune", "Dune Messiah");

			assertThat(resolver.resolve("dune", catalog)).isEqualTo(resolver.resolve("dune", catalog));
			assertThat(resolver.resolve("dune", catalog)).map(MatchedEntry::id).contains("media-2");
		}

		@Test
		@DisplayName("carries the entry's status")
		void carriesStatus() {
			assertThat(resolver.resolve("Dune", snapshot("Dune")))
					.map(MatchedEntry::status).contains("Finished");
		}
	}
}
