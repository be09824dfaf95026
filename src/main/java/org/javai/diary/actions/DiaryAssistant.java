package org.javai.diary.actions;

import java.util.List;
import java.util.Objects;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.CatalogStore;
import org.javai.diary.actions.catalog.CatalogStoreException;
import org.javai.diary.actions.confirm.ConfirmationResult;
import org.javai.diary.actions.confirm.ConfirmationSession;
import org.javai.diary.actions.exec.BatchExecutor;
import org.javai.diary.actions.exec.DefaultBatchExecutor;
import org.javai.diary.actions.generate.ActionGenerator;
import org.javai.diary.actions.generate.ChatClientActionGenerator;
import org.javai.diary.actions.generate.GenerationOutput;
import org.javai.diary.actions.generate.GenerationResult;
import org.javai.diary.actions.generate.MetadataEnricher;
import org.javai.diary.actions.generate.MetadataProvider;
import org.javai.diary.actions.intent.Intent;
import org.javai.diary.actions.intent.IntentClassifier;
import org.javai.diary.actions.query.AnalyticsStore;
import org.javai.diary.actions.query.ChatClientSqlGenerator;
import org.javai.diary.actions.query.GenerationException;
import org.javai.diary.actions.query.QueryExecutor;
import org.javai.diary.actions.query.QueryResult;
import org.javai.diary.actions.query.QueryValidationException;
import org.javai.diary.actions.query.SqlGenerator;
import org.javai.diary.actions.query.SqlGuard;
import org.javai.diary.actions.query.VisualizationPlanner;
import org.javai.diary.actions.resolve.EntityResolver;
import org.javai.diary.actions.validate.ActionValidator;
import org.javai.diary.actions.validate.ValidatedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.lang.NonNull;

/**
 * Entry point of the natural-language pipeline.
 *
 * <p>A request is classified, then either answered from a read-only query or turned into a
 * validated batch of actions that the caller must confirm. Nothing is written to the catalog
 * until {@link #confirm(ConfirmationSession)} (or {@link ConfirmationSession#confirm}) runs.</p>
 *
 * <pre>{@code
 * DiaryAssistant assistant = DiaryAssistant.builder()
 *         .withChatClient(chatClient)
 *         .catalogStore(store)
 *         .analyticsStore(analytics)
 *         .build();
 *
 * if (assistant.handle("mark Inception as finished", Workspace.MEDIA)
 *         instanceof AssistantResponse.Proposal proposal) {
 *     assistant.confirm(proposal.session());
 * }
 * }</pre>
 */
public class DiaryAssistant {

	private static final Logger logger = LoggerFactory.getLogger(DiaryAssistant.class);

	private final IntentClassifier classifier;
	private final ActionGenerator actionGenerator;
	private final MetadataEnricher enricher;
	private final QueryExecutor queryExecutor;
	private final CatalogStore catalogStore;
	private final ActionValidator validator;
	private final BatchExecutor batchExecutor;
	private final AssistantConfig config;

	private DiaryAssistant(Builder builder) {
		this.config = builder.config != null ? builder.config : AssistantConfig.load();
		this.classifier = builder.classifier != null ? builder.classifier : new IntentClassifier();
		this.catalogStore = Objects.requireNonNull(builder.catalogStore, "catalogStore must not be null");

		ActionGenerator generator = builder.actionGenerator;
		SqlGenerator sqlGenerator = builder.sqlGenerator;
		if (builder.chatClient != null) {
			generator = generator != null ? generator : new ChatClientActionGenerator(builder.chatClient);
			sqlGenerator = sqlGenerator != null ? sqlGenerator : new ChatClientSqlGenerator(builder.chatClient);
		}
		this.actionGenerator = Objects.requireNonNull(generator, "actionGenerator or chatClient must be provided");
		this.enricher = builder.metadataProvider != null ? new MetadataEnricher(builder.metadataProvider) : null;

		AnalyticsStore analytics = builder.analyticsStore;
		this.queryExecutor = sqlGenerator != null && analytics != null
				? new QueryExecutor(sqlGenerator, analytics, new SqlGuard(), new VisualizationPlanner(),
						config.maxResultRows())
				: null;

		EntityResolver resolver = config.resolver().create();
		this.validator = new ActionValidator(resolver);
		this.batchExecutor = builder.batchExecutor != null
				? builder.batchExecutor
				: DefaultBatchExecutor.builder()
						.store(catalogStore)
						.resolver(resolver)
						.catalogWindow(config.catalogWindow())
						.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public AssistantConfig config() {
		return config;
	}

	public BatchExecutor batchExecutor() {
		return batchExecutor;
	}

	public AssistantResponse handle(String text, @NonNull Workspace workspace) {
		Objects.requireNonNull(workspace, "workspace must not be null");
		Intent intent = classifier.classify(text);
		logger.debug("Classified request as {} for workspace {}", intent, workspace.wireValue());
		return intent == Intent.ACTION ? propose(text, workspace) : answer(text, workspace);
	}

	/**
	 * Execute the selected actions of a session with this assistant's executor.
	 */
	public ConfirmationResult confirm(@NonNull ConfirmationSession session) {
		Objects.requireNonNull(session, "session must not be null");
		return session.confirm(batchExecutor);
	}

	private AssistantResponse answer(String text, Workspace workspace) {
		if (queryExecutor == null) {
			return new AssistantResponse.Failure("Query mode is not configured");
		}
		try {
			QueryResult result = queryExecutor.execute(text, workspace);
			return new AssistantResponse.Answer(result);
		}
		catch (GenerationException | QueryValidationException ex) {
			return new AssistantResponse.Failure(ex.getMessage());
		}
		catch (CatalogStoreException ex) {
			logger.warn("Analytics query failed", ex);
			return new AssistantResponse.Failure(ex.getMessage());
		}
	}

	private AssistantResponse propose(String text, Workspace workspace) {
		GenerationResult generated = actionGenerator.generate(text, workspace);
		if (generated instanceof GenerationResult.Failure failure) {
			return new AssistantResponse.Failure(failure.reason());
		}
		GenerationOutput output = ((GenerationResult.Success) generated).output();

		CatalogSnapshot snapshot;
		try {
			snapshot = catalogStore.recent(workspace, config.catalogWindow());
		}
		catch (CatalogStoreException ex) {
			logger.warn("Failed to load catalog snapshot", ex);
			return new AssistantResponse.Failure("Failed to load diary entries: " + ex.getMessage());
		}

		List<CatalogAction> actions = enricher != null
				? enricher.enrichAll(workspace, output.actions())
				: output.actions();
		List<ValidatedAction> validated = validator.validateAll(actions, snapshot);
		ConfirmationSession session = new ConfirmationSession(output.intent(), validated, output.rejected(),
				validator, snapshot, config.revalidateOnEdit());
		logger.debug("Proposed {} action(s), {} valid, {} rejected", session.size(), session.validCount(),
				session.rejected().size());
		return new AssistantResponse.Proposal(session);
	}

	public static final class Builder {
		private ChatClient chatClient;
		private ActionGenerator actionGenerator;
		private SqlGenerator sqlGenerator;
		private MetadataProvider metadataProvider;
		private CatalogStore catalogStore;
		private AnalyticsStore analyticsStore;
		private BatchExecutor batchExecutor;
		private IntentClassifier classifier;
		private AssistantConfig config;

		private Builder() {
		}

		/**
		 * Use one chat client for both oracles unless a generator is set explicitly.
		 */
		public Builder withChatClient(ChatClient chatClient) {
			this.chatClient = chatClient;
			return this;
		}

		public Builder actionGenerator(ActionGenerator actionGenerator) {
			this.actionGenerator = actionGenerator;
			return this;
		}

		public Builder sqlGenerator(SqlGenerator sqlGenerator) {
			this.sqlGenerator = sqlGenerator;
			return this;
		}

		/**
		 * Fill create actions with looked-up metadata before validation. Optional.
		 */
		public Builder metadataProvider(MetadataProvider metadataProvider) {
			this.metadataProvider = metadataProvider;
			return this;
		}

		public Builder catalogStore(CatalogStore catalogStore) {
			this.catalogStore = catalogStore;
			return this;
		}

		public Builder analyticsStore(AnalyticsStore analyticsStore) {
			this.analyticsStore = analyticsStore;
			return this;
		}

		public Builder batchExecutor(BatchExecutor batchExecutor) {
			this.batchExecutor = batchExecutor;
			return this;
		}

		public Builder classifier(IntentClassifier classifier) {
			this.classifier = classifier;
			return this;
		}

		public Builder config(AssistantConfig config) {
			this.config = config;
			return this;
		}

		public DiaryAssistant build() {
			return new DiaryAssistant(this);
		}
	}
}
