package org.javai.diary.actions.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.generate.JsonResponses;
import org.javai.diary.actions.generate.OracleClient;
import org.javai.diary.actions.generate.OraclePrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link SqlGenerator} backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientSqlGenerator implements SqlGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientSqlGenerator.class);

	private final OracleClient oracle;
	private final ObjectMapper mapper;

	public ChatClientSqlGenerator(ChatClient chatClient) {
		this(chatClient, new ObjectMapper());
	}

	public ChatClientSqlGenerator(ChatClient chatClient, ObjectMapper mapper) {
		this.oracle = new OracleClient(chatClient);
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	@Override
	public SqlGeneration generate(String text, Workspace workspace) {
		Objects.requireNonNull(workspace, "workspace must not be null");
		if (text == null || text.isBlank()) {
			throw new GenerationException("Question text is empty");
		}

		String content;
		try {
			content = oracle.call(OraclePrompts.queryMessages(workspace), text);
		}
		catch (RuntimeException ex) {
			logger.warn("SQL generation call failed", ex);
			throw new GenerationException("SQL generation failed: " + ex.getMessage(), ex);
		}

		String json = JsonResponses.extractJson(content)
				.orElseThrow(() -> new GenerationException("Model response does not contain valid JSON"));
		SqlGeneration generation;
		try {
			generation = mapper.readValue(json, SqlGeneration.class);
		}
		catch (JsonProcessingException ex) {
			throw new GenerationException("Failed to parse SQL JSON: " + ex.getOriginalMessage(), ex);
		}
		if (generation.sql() == null || generation.sql().isBlank()) {
			throw new GenerationException("Model response does not contain SQL");
		}
		return generation;
	}
}
