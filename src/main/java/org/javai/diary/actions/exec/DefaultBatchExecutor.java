package org.javai.diary.actions.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.catalog.CatalogEntry;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.CatalogStore;
import org.javai.diary.actions.catalog.MatchedEntry;
import org.javai.diary.actions.resolve.EntityResolver;
import org.javai.diary.actions.resolve.RankedEntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sequential executor over a {@link CatalogStore}.
 * <p>
 * Each action is applied independently: a {@link RuntimeException} thrown by the store for one
 * action is recorded as that action's failure and execution continues with the next. There is no
 * rollback. An update or delete that arrives without a target id is resolved by title against a
 * fresh snapshot.
 */
public class DefaultBatchExecutor implements BatchExecutor {

	private static final Logger logger = LoggerFactory.getLogger(DefaultBatchExecutor.class);

	private final CatalogStore store;
	private final EntityResolver resolver;
	private final int catalogWindow;

	private DefaultBatchExecutor(Builder builder) {
		this.store = Objects.requireNonNull(builder.store, "store must not be null");
		this.resolver = builder.resolver != null ? builder.resolver : new RankedEntityResolver();
		this.catalogWindow = builder.catalogWindow;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public BatchReport execute(Workspace workspace, List<CatalogAction> actions) {
		Objects.requireNonNull(workspace, "workspace must not be null");
		if (actions == null || actions.isEmpty()) {
			return BatchReport.of(List.of());
		}

		List<ExecutionResult> results = new ArrayList<>(actions.size());
		for (int i = 0; i < actions.size(); i++) {
			results.add(executeOne(workspace, actions.get(i), i));
		}

		BatchReport report = BatchReport.of(results);
		logger.info("Executed {} {} action(s): {} succeeded, {} failed", report.summary().total(),
				workspace.wireValue(), report.summary().succeeded(), report.summary().failed());
		return report;
	}

	private ExecutionResult executeOne(Workspace workspace, CatalogAction action, int index) {
		if (action == null) {
			return ExecutionResult.failed(null, "Action is null");
		}
		try {
			return switch (action.kind()) {
				case CREATE -> create(workspace, action);
				case UPDATE -> update(workspace, action);
				case DELETE -> delete(workspace, action);
			};
		}
		catch (RuntimeException ex) {
			logger.warn("Action {} ({}) failed: {}", index, action.kind().wireValue(), ex.getMessage(), ex);
			return ExecutionResult.failed(action, ex.getMessage());
		}
	}

	private ExecutionResult create(Workspace workspace, CatalogAction action) {
		if (action.title(workspace).filter(StringUtils::isNotBlank).isEmpty()) {
			return ExecutionResult.failed(action, "Title is required for create action");
		}
		CatalogEntry created = store.insert(workspace, action.payload());
		return ExecutionResult.succeeded(action, created.id());
	}

	private ExecutionResult update(Workspace workspace, CatalogAction action) {
		Optional<String> target = resolveTarget(workspace, action);
		if (target.isEmpty()) {
			return missingTarget(action);
		}
		CatalogEntry updated = store.update(workspace, target.get(), action.payload());
		return ExecutionResult.succeeded(action, updated.id());
	}

	private ExecutionResult delete(Workspace workspace, CatalogAction action) {
		Optional<String> target = resolveTarget(workspace, action);
		if (target.isEmpty()) {
			return missingTarget(action);
		}
		store.delete(workspace, target.get());
		return ExecutionResult.succeeded(action, target.get());
	}

	private Optional<String> resolveTarget(Workspace workspace, CatalogAction action) {
		if (action.targetId() != null) {
			return Optional.of(action.targetId());
		}
		Optional<String> title = action.title(workspace).filter(StringUtils::isNotBlank);
		if (title.isEmpty()) {
			return Optional.empty();
		}
		CatalogSnapshot snapshot = store.recent(workspace, catalogWindow);
		return resolver.resolve(title.get(), snapshot).map(MatchedEntry::id);
	}

	private static ExecutionResult missingTarget(CatalogAction action) {
		return ExecutionResult.failed(action,
				"Entry ID or title match is required for " + action.kind().wireValue() + " action");
	}

	public static final class Builder {
		private CatalogStore store;
		private EntityResolver resolver;
		private int catalogWindow = CatalogSnapshot.DEFAULT_WINDOW;

		private Builder() {
		}

		public Builder store(CatalogStore store) {
			this.store = store;
			return this;
		}

		public Builder resolver(EntityResolver resolver) {
			this.resolver = resolver;
			return this;
		}

		/**
		 * Number of recent entries searched when an update or delete has to be resolved by title.
		 */
		public Builder catalogWindow(int catalogWindow) {
			if (catalogWindow <= 0) {
				throw new IllegalArgumentException("catalogWindow must be positive, got: " + catalogWindow);
			}
			this.catalogWindow = catalogWindow;
			return this;
		}

		public DefaultBatchExecutor build() {
			return new DefaultBatchExecutor(this);
		}
	}
}
