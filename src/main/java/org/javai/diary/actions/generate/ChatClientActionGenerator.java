package org.javai.diary.actions.generate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.diary.actions.api.ActionKind;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link ActionGenerator} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Sends the workspace's system messages followed by the user text, extracts the JSON
 * object from the reply and maps it onto {@link CatalogAction}s. An unreachable model,
 * a reply without JSON or malformed JSON produce a {@link GenerationResult.Failure};
 * nothing is thrown. Items of an unknown kind are reported as {@link RejectedAction}s
 * and the rest of the batch is kept.</p>
 */
public class ChatClientActionGenerator implements ActionGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientActionGenerator.class);

	private final OracleClient oracle;
	private final ObjectMapper mapper;

	public ChatClientActionGenerator(ChatClient chatClient) {
		this(chatClient, new ObjectMapper());
	}

	public ChatClientActionGenerator(ChatClient chatClient, ObjectMapper mapper) {
		this.oracle = new OracleClient(chatClient);
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	@Override
	public GenerationResult generate(String text, Workspace workspace) {
		Objects.requireNonNull(workspace, "workspace must not be null");
		if (text == null || text.isBlank()) {
			return GenerationResult.failure("Request text is empty");
		}

		String content;
		try {
			content = oracle.call(OraclePrompts.actionMessages(workspace), text);
		}
		catch (RuntimeException ex) {
			logger.warn("Action generation call failed", ex);
			return GenerationResult.failure("Action generation failed: " + ex.getMessage(), ex);
		}

		Optional<String> json = JsonResponses.extractJson(content);
		if (json.isEmpty()) {
			logger.warn("Model response does not contain a JSON object: {}", content);
			return GenerationResult.failure("Model response does not contain valid JSON actions");
		}

		RawActionBatch batch;
		try {
			batch = RawActionBatch.fromJson(json.get(), mapper);
		}
		catch (JsonProcessingException ex) {
			logger.warn("Failed to parse actions JSON: {}", ex.getOriginalMessage());
			return GenerationResult.failure("Failed to parse actions JSON: " + ex.getOriginalMessage(), ex);
		}
		return toOutput(batch);
	}

	private GenerationResult toOutput(RawActionBatch batch) {
		List<CatalogAction> actions = new ArrayList<>();
		List<RejectedAction> rejected = new ArrayList<>();
		List<RawAction> rawActions = batch.actions() != null ? batch.actions() : List.of();
		for (int i = 0; i < rawActions.size(); i++) {
			RawAction raw = rawActions.get(i);
			if (raw == null) {
				continue;
			}
			try {
				ActionKind kind = ActionKind.fromWireValue(raw.type());
				actions.add(new CatalogAction(kind, raw.id(), ActionPayload.of(raw.data())));
			}
			catch (IllegalArgumentException ex) {
				logger.warn("Action {} has unsupported type '{}'", i, raw.type());
				rejected.add(new RejectedAction(i, raw.type(), raw.data(), "Invalid action type: " + raw.type()));
			}
		}
		return GenerationResult.success(new GenerationOutput(batch.intent(), actions, rejected));
	}
}
