package org.javai.diary.actions.catalog;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.Workspace;

/**
 * In-memory {@link CatalogStore} for tests or simple local use.
 *
 * <p>Supports fluent seeding of rows:</p>
 *
 * <pre>{@code
 * InMemoryCatalogStore store = new InMemoryCatalogStore()
 *     .addEntry(Workspace.MEDIA, Map.of("title", "The Room", "status", "Finished"))
 *     .addEntry(Workspace.MEDIA, Map.of("title", "Inception", "status", "Watching"));
 * }</pre>
 *
 * <p>Identifiers are {@code <workspace>-<sequence>}. Creation timestamps are strictly
 * increasing so that rows added later always sort as more recent.</p>
 */
public final class InMemoryCatalogStore implements CatalogStore {

	private final Map<Workspace, Map<String, CatalogEntry>> rows = new EnumMap<>(Workspace.class);
	private final AtomicLong sequence = new AtomicLong();
	private final Clock clock;
	private Instant lastTimestamp = Instant.EPOCH;

	public InMemoryCatalogStore() {
		this(Clock.systemUTC());
	}

	public InMemoryCatalogStore(Clock clock) {
		this.clock = clock != null ? clock : Clock.systemUTC();
		for (Workspace workspace : Workspace.values()) {
			rows.put(workspace, new LinkedHashMap<>());
		}
	}

	/**
	 * Seed a row. Rows added later are considered more recent.
	 *
	 * @return this store for fluent chaining
	 */
	public InMemoryCatalogStore addEntry(Workspace workspace, Map<String, ?> fields) {
		insert(workspace, ActionPayload.of(fields));
		return this;
	}

	@Override
	public synchronized CatalogSnapshot recent(Workspace workspace, int limit) {
		return CatalogSnapshot.of(workspace, new ArrayList<>(table(workspace).values()), limit);
	}

	@Override
	public synchronized Optional<CatalogEntry> findById(Workspace workspace, String id) {
		if (id == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(table(workspace).get(id));
	}

	@Override
	public synchronized CatalogEntry insert(Workspace workspace, ActionPayload fields) {
		String id = workspace.wireValue() + "-" + sequence.incrementAndGet();
		CatalogEntry entry = new CatalogEntry(id, workspace, fields, nextTimestamp());
		table(workspace).put(id, entry);
		return entry;
	}

	@Override
	public synchronized CatalogEntry update(Workspace workspace, String id, ActionPayload patch) {
		CatalogEntry existing = table(workspace).get(id);
		if (existing == null) {
			throw new CatalogStoreException("No " + workspace.wireValue() + " entry with id " + id);
		}
		ActionPayload merged = existing.fields().merge(patch != null ? patch.asMap() : Map.of());
		CatalogEntry updated = new CatalogEntry(id, workspace, merged, existing.createdAt());
		table(workspace).put(id, updated);
		return updated;
	}

	@Override
	public synchronized void delete(Workspace workspace, String id) {
		if (table(workspace).remove(id) == null) {
			throw new CatalogStoreException("No " + workspace.wireValue() + " entry with id " + id);
		}
	}

	@Override
	public synchronized List<CatalogEntry> all(Workspace workspace) {
		return recent(workspace, Integer.MAX_VALUE).entries();
	}

	private Map<String, CatalogEntry> table(Workspace workspace) {
		if (workspace == null) {
			throw new CatalogStoreException("Workspace must not be null");
		}
		return rows.get(workspace);
	}

	private Instant nextTimestamp() {
		Instant now = clock.instant();
		if (!now.isAfter(lastTimestamp)) {
			now = lastTimestamp.plusMillis(1);
		}
		lastTimestamp = now;
		return now;
	}
}
