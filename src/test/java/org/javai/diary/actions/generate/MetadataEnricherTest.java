package org.javai.diary.actions.generate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetadataEnricher")
class MetadataEnricherTest {

	private static final Map<String, Object> DUNE_METADATA = Map.of(
			"year", "2021",
			"poster_url", "https://img.example/dune.jpg",
			"medium", "Movie",
			"status", "Finished");

	@Test
	@DisplayName("looked-up fields fill gaps and proposed fields win")
	void proposedFieldsWin() {
		MetadataEnricher enricher = new MetadataEnricher((workspace, fields) -> DUNE_METADATA);

		CatalogAction enriched = enricher.enrich(Workspace.MEDIA,
				CatalogAction.create(Map.of("title", "Dune", "status", "Planned")));

		assertThat(enriched.payload().asMap())
				.containsEntry("title", "Dune")
				.containsEntry("status", "Planned")
				.containsEntry("year", "2021")
				.containsEntry("poster_url", "https://img.example/dune.jpg")
				.containsEntry("medium", "Movie");
	}

	@Test
	@DisplayName("a failing lookup leaves the action unchanged")
	void failureTolerated() {
		MetadataEnricher enricher = new MetadataEnricher((workspace, fields) -> {
			throw new IllegalStateException("metadata service unavailable");
		});
		CatalogAction create = CatalogAction.create(Map.of("title", "Dune"));

		try (LogCaptorAppender captor = LogCaptorAppender.capture(MetadataEnricher.class, Level.WARN)) {
			assertThat(enricher.enrich(Workspace.MEDIA, create)).isEqualTo(create);
			assertThat(captor.messagesAt(Level.WARN))
					.anyMatch(message -> message.contains("metadata service unavailable"));
		}
	}

	@Test
	@DisplayName("an empty lookup leaves the action unchanged")
	void emptyLookup() {
		MetadataEnricher enricher = new MetadataEnricher((workspace, fields) -> Map.of());
		CatalogAction create = CatalogAction.create(Map.of("title", "Dune"));

		assertThat(enricher.enrich(Workspace.MEDIA, create)).isEqualTo(create);
	}

	@Test
	@DisplayName("only titled create actions are looked up")
	void onlyTitledCreates() {
		List<String> lookedUp = new ArrayList<>();
		MetadataEnricher enricher = new MetadataEnricher((workspace, fields) -> {
			lookedUp.add(fields.text(workspace.titleField()).orElse("?"));
			return DUNE_METADATA;
		});

		List<CatalogAction> result = enricher.enrichAll(Workspace.MEDIA, List.of(
				CatalogAction.update(Map.of("title", "Inception", "status", "Finished")),
				CatalogAction.delete(Map.of("title", "The Room")),
				CatalogAction.create(Map.of("status", "Planned")),
				CatalogAction.create(Map.of("title", "Dune"))));

		assertThat(lookedUp).containsExactly("Dune");
		assertThat(result.get(0).payload().has("year")).isFalse();
		assertThat(result.get(3).payload().has("year")).isTrue();
	}

	@Test
	@DisplayName("food creates are looked up by name")
	void foodUsesName() {
		MetadataEnricher enricher = new MetadataEnricher((workspace, fields) -> Map.of("cuisine_type", List.of("Thai")));

		CatalogAction enriched = enricher.enrich(Workspace.FOOD, CatalogAction.create(Map.of("name", "Noodle Bar")));

		assertThat(enriched.payload().asMap()).containsEntry("cuisine_type", List.of("Thai"));
	}
}
