package org.javai.diary.actions.generate;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Sends system messages followed by the user text through a {@link ChatClient} and returns the raw reply.
 * Shared by the action and SQL oracles.
 */
public final class OracleClient {

	private static final Logger logger = LoggerFactory.getLogger(OracleClient.class);

	private final ChatClient chatClient;

	public OracleClient(ChatClient chatClient) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
	}

	public String call(List<String> systemMessages, String userText) {
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		systemMessages.forEach(request::system);
		request.user(userText);
		String content = request.call().content();
		if (logger.isDebugEnabled()) {
			logger.debug("System messages:\n{}", String.join("\n---\n", systemMessages));
		}
		logger.info("User message:\n{}", userText);
		logger.info("LLM response:\n{}", content);
		return content;
	}
}
