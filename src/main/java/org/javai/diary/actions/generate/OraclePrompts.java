package org.javai.diary.actions.generate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.javai.diary.actions.api.ActionFields;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.validate.WorkspaceSchema;

/**
 * System messages sent to the oracle, one set per workspace and mode.
 *
 * <p>The output directive is always the last system message, immediately before the user text.</p>
 */
public final class OraclePrompts {

	private static final List<String> MEDIA_FIELDS = List.of(
			ActionFields.TITLE, ActionFields.MEDIUM, ActionFields.TYPE, ActionFields.STATUS,
			ActionFields.GENRE, ActionFields.PLATFORM, ActionFields.MY_RATING, ActionFields.START_DATE,
			ActionFields.FINISH_DATE, ActionFields.LANGUAGE, ActionFields.EPISODES,
			ActionFields.EPISODES_WATCHED, ActionFields.PRICE, ActionFields.POSTER_URL,
			ActionFields.IMDB_ID, ActionFields.AVERAGE_RATING, ActionFields.YEAR, ActionFields.PLOT,
			ActionFields.SEASON, ActionFields.LENGTH);

	private static final List<String> FOOD_FIELDS = List.of(
			ActionFields.NAME, ActionFields.VISIT_DATE, ActionFields.CATEGORY, ActionFields.OVERALL_RATING,
			ActionFields.FOOD_RATING, ActionFields.AMBIANCE_RATING, ActionFields.SERVICE_RATING,
			ActionFields.VALUE_RATING, ActionFields.TOTAL_PRICE, ActionFields.PRICE_LEVEL,
			ActionFields.CUISINE_TYPE, ActionFields.DINING_TYPE, ActionFields.TAGS,
			ActionFields.WOULD_RETURN, ActionFields.NOTES);

	private static final String ACTION_DIRECTIVE = """
			OUTPUT FORMAT - JSON ONLY:

			Respond with a JSON object. No prose. No markdown. Just JSON.

			EXAMPLE:
			{
			  "intent": "Add Dune and mark Inception as finished",
			  "actions": [
			    { "type": "create", "data": { "%1$s": "Dune", "my_rating": 8 } },
			    { "type": "update", "data": { "%1$s": "Inception", "status": "Finished" } }
			  ]
			}

			RULES:
			- "type" is one of: create, update, delete
			- every action carries the entry's "%1$s" in "data"
			- only include fields the user actually mentioned
			- dates use YYYY-MM-DD
			- ratings are numbers from 0 to 10
			- if the request asks for nothing to change, return an empty "actions" array

			STOP after the closing brace. Emit nothing else.""";

	private static final String QUERY_DIRECTIVE = """
			OUTPUT FORMAT - JSON ONLY:

			Respond with a JSON object. No prose. No markdown. Just JSON.

			EXAMPLE:
			{
			  "sql": "SELECT status, COUNT(*) AS count FROM %1$s GROUP BY status",
			  "explanation": "Number of entries per status",
			  "visualizationType": "pie"
			}

			RULES:
			- "sql" is a single SELECT statement against the table %1$s
			- NEVER write INSERT, UPDATE, DELETE or DDL
			- NEVER invent columns - only use the columns listed above
			- "visualizationType" is optional; one of: kpi, table, bar, pie, line, area

			STOP after the closing brace. Emit nothing else.""";

	private OraclePrompts() {
	}

	public static List<String> fields(Workspace workspace) {
		return workspace == Workspace.FOOD ? FOOD_FIELDS : MEDIA_FIELDS;
	}

	/**
	 * System messages for action mode.
	 */
	public static List<String> actionMessages(Workspace workspace) {
		List<String> messages = new ArrayList<>();
		messages.add(describeWorkspace(workspace));
		messages.add(describeFields(workspace));
		messages.add(ACTION_DIRECTIVE.formatted(workspace.titleField()));
		return List.copyOf(messages);
	}

	/**
	 * System messages for query mode.
	 */
	public static List<String> queryMessages(Workspace workspace) {
		List<String> messages = new ArrayList<>();
		messages.add(describeWorkspace(workspace));
		messages.add("TABLE " + workspace.tableName() + " COLUMNS: id, created_at, "
				+ String.join(", ", fields(workspace)));
		messages.add(QUERY_DIRECTIVE.formatted(workspace.tableName()));
		return List.copyOf(messages);
	}

	private static String describeWorkspace(Workspace workspace) {
		return switch (workspace) {
			case MEDIA -> "You help a single user keep a diary of the films, series and books they watch or read.";
			case FOOD -> "You help a single user keep a diary of the restaurants and cafes they visit.";
		};
	}

	private static String describeFields(Workspace workspace) {
		WorkspaceSchema schema = WorkspaceSchema.of(workspace);
		StringBuilder sb = new StringBuilder();
		sb.append("FIELDS: ").append(String.join(", ", fields(workspace))).append('\n');
		sb.append("RATING FIELDS (0-10): ").append(String.join(", ", schema.ratingFields())).append('\n');
		sb.append("DATE FIELDS (YYYY-MM-DD): ").append(String.join(", ", schema.dateFields())).append('\n');
		if (workspace == Workspace.MEDIA) {
			sb.append("STATUS VALUES: ")
					.append(WorkspaceSchema.STANDARD_STATUSES.stream().sorted().collect(Collectors.joining(", ")))
					.append('\n');
		}
		for (String field : schema.advisoryFields()) {
			sb.append(field.toUpperCase(Locale.ROOT)).append(" VALUES: ")
					.append(String.join(", ", schema.standardValues(field))).append('\n');
		}
		return sb.toString().trim();
	}
}
