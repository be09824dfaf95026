package org.javai.diary.actions.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CatalogAction")
class CatalogActionTest {

	private final ObjectMapper mapper = new ObjectMapper();

	@Nested
	@DisplayName("wire format")
	class WireFormat {

		@Test
		@DisplayName("reads type, id and data")
		void readsWireShape() throws Exception {
			String json = """
					{ "type": "update", "id": "media-3", "data": { "title": "Inception", "my_rating": 9 } }
					""";

			CatalogAction action = mapper.readValue(json, CatalogAction.class);

			assertThat(action.kind()).isEqualTo(ActionKind.UPDATE);
			assertThat(action.targetId()).isEqualTo("media-3");
			assertThat(action.payload().text("title")).contains("Inception");
			assertThat(action.payload().number("my_rating")).contains(9);
		}

		@Test
		@DisplayName("accepts kind/targetId/payload aliases")
		void acceptsAliases() throws Exception {
			String json = """
					{ "kind": "DELETE", "targetId": "media-1", "payload": { "title": "Dune" } }
					""";

			CatalogAction action = mapper.readValue(json, CatalogAction.class);

			assertThat(action.kind()).isEqualTo(ActionKind.DELETE);
			assertThat(action.targetId()).isEqualTo("media-1");
		}

		@Test
		@DisplayName("omits a missing id when written")
		void omitsMissingId() throws Exception {
			String json = mapper.writeValueAsString(CatalogAction.create(Map.of("title", "Dune")));

			assertThat(json).isEqualTo("{\"type\":\"create\",\"data\":{\"title\":\"Dune\"}}");
		}

		@Test
		@DisplayName("rejects unknown kinds")
		void rejectsUnknownKind() {
			assertThatThrownBy(() -> ActionKind.fromWireValue("upsert"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("upsert");
		}
	}

	@Nested
	@DisplayName("copies")
	class Copies {

		@Test
		@DisplayName("withPatch merges fields and removes null-valued ones")
		void patchMergesAndRemoves() {
			CatalogAction action = CatalogAction.create(Map.of("title", "Dune", "status", "Watching"));
			Map<String, Object> patch = new HashMap<>();
			patch.put("status", null);
			patch.put("my_rating", 8);

			CatalogAction patched = action.withPatch(patch);

			assertThat(patched.payload().asMap()).containsOnlyKeys("title", "my_rating");
			assertThat(action.payload().asMap()).containsKey("status");
		}

		@Test
		@DisplayName("blank target ids are treated as absent")
		void blankTargetIsAbsent() {
			CatalogAction action = CatalogAction.update(Map.of("title", "Dune")).withTargetId("  ");

			assertThat(action.target()).isEmpty();
		}

		@Test
		@DisplayName("title reads the workspace's title field")
		void titleUsesWorkspaceField() {
			CatalogAction action = CatalogAction.create(Map.of("name", "Chez Panisse"));

			assertThat(action.title(Workspace.FOOD)).contains("Chez Panisse");
			assertThat(action.title(Workspace.MEDIA)).isEmpty();
		}
	}

	@Test
	@DisplayName("payload drops null values and blank keys")
	void payloadDropsNulls() {
		Map<String, Object> fields = new HashMap<>();
		fields.put("title", "Dune");
		fields.put("genre", null);
		fields.put(" ", "x");

		ActionPayload payload = ActionPayload.of(fields);

		assertThat(payload.asMap()).containsOnlyKeys("title");
		assertThat(payload.has("genre")).isFalse();
	}
}
