package org.javai.diary.actions.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.Level;
import org.javai.diary.actions.api.ActionKind;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.catalog.CatalogEntry;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.CatalogStore;
import org.javai.diary.actions.catalog.CatalogStoreException;
import org.javai.diary.actions.catalog.InMemoryCatalogStore;
import org.javai.diary.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultBatchExecutor")
class DefaultBatchExecutorTest {

	private InMemoryCatalogStore store;
	private DefaultBatchExecutor executor;

	@BeforeEach
	void setUp() {
		store = new InMemoryCatalogStore()
				.addEntry(Workspace.MEDIA, Map.of("title", "The Room", "status", "Finished"))
				.addEntry(Workspace.MEDIA, Map.of("title", "Inception", "status", "Watching"))
				.addEntry(Workspace.FOOD, Map.of("name", "Luigi's", "overall_rating", 7));
		executor = DefaultBatchExecutor.builder().store(store).build();
	}

	private String idOf(Workspace workspace, String title) {
		return store.all(workspace).stream()
				.filter(entry -> entry.title().equals(title))
				.map(CatalogEntry::id)
				.findFirst()
				.orElseThrow();
	}

	@Nested
	@DisplayName("create")
	class Create {

		@Test
		@DisplayName("inserts the payload and reports the new id")
		void inserts() {
			BatchReport report = executor.execute(Workspace.MEDIA,
					List.of(CatalogAction.create(Map.of("title", "Arrival", "status", "Planned"))));

			ExecutionResult result = report.results().get(0);
			assertThat(result.success()).isTrue();
			assertThat(result.entryId()).isEqualTo(idOf(Workspace.MEDIA, "Arrival"));
			assertThat(store.findById(Workspace.MEDIA, result.entryId()))
					.map(entry -> entry.status().orElse(""))
					.contains("Planned");
		}

		@Test
		@DisplayName("fails without a title and writes nothing")
		void requiresTitle() {
			BatchReport report = executor.execute(Workspace.MEDIA,
					List.of(CatalogAction.create(Map.of("title", "  ", "status", "Planned"))));

			assertThat(report.results().get(0).error()).isEqualTo("Title is required for create action");
			assertThat(store.all(Workspace.MEDIA)).hasSize(2);
		}

		@Test
		@DisplayName("uses the workspace's title field")
		void foodUsesName() {
			BatchReport report = executor.execute(Workspace.FOOD,
					List.of(CatalogAction.create(Map.of("name", "Noodle Bar", "price_level", "$$"))));

			assertThat(report.success()).isTrue();
			assertThat(report.results().get(0).entryId()).startsWith("food-");
		}
	}

	@Nested
	@DisplayName("update and delete")
	class UpdateDelete {

		@Test
		@DisplayName("use the target id when present")
		void byTargetId() {
			String id = idOf(Workspace.MEDIA, "Inception");
			CatalogAction update = new CatalogAction(ActionKind.UPDATE, id,
					ActionPayload.of(Map.of("status", "Finished", "my_rating", 9)));

			BatchReport report = executor.execute(Workspace.MEDIA, List.of(update));

			assertThat(report.results().get(0).entryId()).isEqualTo(id);
			CatalogEntry updated = store.findById(Workspace.MEDIA, id).orElseThrow();
			assertThat(updated.status()).contains("Finished");
			assertThat(updated.title()).isEqualTo("Inception");
		}

		@Test
		@DisplayName("fall back to resolving the title")
		void byTitle() {
			String roomId = idOf(Workspace.MEDIA, "The Room");

			BatchReport report = executor.execute(Workspace.MEDIA,
					List.of(CatalogAction.delete(Map.of("title", "the room"))));

			assertThat(report.results().get(0).success()).isTrue();
			assertThat(report.results().get(0).entryId()).isEqualTo(roomId);
			assertThat(store.findById(Workspace.MEDIA, roomId)).isEmpty();
		}

		@Test
		@DisplayName("fail when neither id nor title identifies an entry")
		void noTarget() {
			BatchReport report = executor.execute(Workspace.MEDIA, List.of(
					CatalogAction.update(Map.of("title", "Tenet", "status", "Finished")),
					CatalogAction.delete(Map.of("status", "Dropped"))));

			assertThat(report.results()).extracting(ExecutionResult::error).containsExactly(
					"Entry ID or title match is required for update action",
					"Entry ID or title match is required for delete action");
			assertThat(report.summary()).isEqualTo(new ExecutionSummary(2, 0, 2));
		}
	}

	@Test
	@DisplayName("one failing action does not stop the rest of the batch")
	void isolatesFailures() {
		CatalogStore failing = new FailingInsertStore(store, "Broken");
		DefaultBatchExecutor isolated = DefaultBatchExecutor.builder().store(failing).build();

		try (LogCaptorAppender captor = LogCaptorAppender.capture(DefaultBatchExecutor.class, Level.WARN)) {
			BatchReport report = isolated.execute(Workspace.MEDIA, List.of(
					CatalogAction.create(Map.of("title", "Arrival")),
					CatalogAction.create(Map.of("title", "Broken")),
					CatalogAction.delete(Map.of("title", "The Room"))));

			assertThat(report.results()).extracting(ExecutionResult::success).containsExactly(true, false, true);
			assertThat(report.results().get(1).error()).isEqualTo("insert rejected");
			assertThat(report.summary()).isEqualTo(new ExecutionSummary(3, 2, 1));
			assertThat(report.success()).isFalse();
			assertThat(captor.messagesAt(Level.WARN)).anyMatch(message -> message.contains("insert rejected"));
		}

		assertThat(store.all(Workspace.MEDIA)).extracting(CatalogEntry::title)
				.containsExactlyInAnyOrder("Inception", "Arrival");
	}

	@Test
	@DisplayName("a vanished target is reported as that action's failure")
	void staleTargetId() {
		CatalogAction delete = new CatalogAction(ActionKind.DELETE, "media-404",
				ActionPayload.of(Map.of("title", "Ghost")));

		BatchReport report = executor.execute(Workspace.MEDIA, List.of(delete));

		assertThat(report.results().get(0).success()).isFalse();
		assertThat(report.results().get(0).error()).contains("media-404");
	}

	@Test
	@DisplayName("an empty batch yields an empty report")
	void emptyBatch() {
		BatchReport report = executor.execute(Workspace.MEDIA, List.of());

		assertThat(report.results()).isEmpty();
		assertThat(report.summary()).isEqualTo(new ExecutionSummary(0, 0, 0));
	}

	@Test
	@DisplayName("requires a store and a positive catalog window")
	void builderChecks() {
		assertThatThrownBy(() -> DefaultBatchExecutor.builder().build()).isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> DefaultBatchExecutor.builder().catalogWindow(0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private static final class FailingInsertStore implements CatalogStore {
		private final CatalogStore delegate;
		private final String failingTitle;

		FailingInsertStore(CatalogStore delegate, String failingTitle) {
			this.delegate = delegate;
			this.failingTitle = failingTitle;
		}

		@Override
		public CatalogSnapshot recent(Workspace workspace, int limit) {
			return delegate.recent(workspace, limit);
		}

		@Override
		public Optional<CatalogEntry> findById(Workspace workspace, String id) {
			return delegate.findById(workspace, id);
		}

		@Override
		public CatalogEntry insert(Workspace workspace, ActionPayload fields) {
			if (fields.text(workspace.titleField()).filter(failingTitle::equals).isPresent()) {
				throw new CatalogStoreException("insert rejected");
			}
			return delegate.insert(workspace, fields);
		}

		@Override
		public CatalogEntry update(Workspace workspace, String id, ActionPayload patch) {
			return delegate.update(workspace, id, patch);
		}

		@Override
		public void delete(Workspace workspace, String id) {
			delegate.delete(workspace, id);
		}
	}
}
