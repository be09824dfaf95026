package org.javai.diary.actions.intent;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Keyword router between query mode and action mode.
 *
 * <p>Any action verb appearing as a whole word routes the request to {@link Intent#ACTION}.
 * The check favours recall: a question that merely mentions "add" is sent to action
 * mode, where the oracle may still answer with an empty batch. Everything else, including
 * blank input, is a {@link Intent#QUERY}.</p>
 */
public class IntentClassifier {

	static final Set<String> ACTION_WORDS = Set.of(
			"add", "adds", "added", "adding",
			"create", "creates", "created", "creating",
			"new",
			"update", "updates", "updated", "updating",
			"change", "changes", "changed", "changing",
			"modify", "modifies", "modified", "modifying",
			"mark", "marks", "marked", "marking",
			"set", "sets", "setting",
			"delete", "deletes", "deleted", "deleting",
			"remove", "removes", "removed", "removing");

	private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}']+");

	public Intent classify(String text) {
		if (StringUtils.isBlank(text)) {
			return Intent.QUERY;
		}
		for (String word : WORD_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
			if (ACTION_WORDS.contains(word)) {
				return Intent.ACTION;
			}
		}
		return Intent.QUERY;
	}
}
