package org.javai.diary.actions.generate;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of a model response that may wrap it in a markdown fence.
 */
public final class JsonResponses {

	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	private JsonResponses() {
	}

	public static Optional<String> extractJson(String response) {
		if (response == null || response.isBlank()) {
			return Optional.empty();
		}
		String trimmed = response.trim();

		Matcher matcher = JSON_BLOCK_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			return Optional.of(matcher.group(1).trim());
		}

		if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
			return Optional.of(trimmed);
		}

		// prose around a bare object
		int start = trimmed.indexOf('{');
		int end = trimmed.lastIndexOf('}');
		if (start >= 0 && end > start) {
			return Optional.of(trimmed.substring(start, end + 1));
		}
		return Optional.empty();
	}
}
