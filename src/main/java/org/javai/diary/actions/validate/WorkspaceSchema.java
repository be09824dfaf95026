package org.javai.diary.actions.validate;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.diary.actions.api.ActionFields;
import org.javai.diary.actions.api.Workspace;

/**
 * Field rules of one workspace: which fields are ratings, dates and non-negative numbers,
 * and the advisory enumerations for categorical fields.
 */
public enum WorkspaceSchema {

	MEDIA(Workspace.MEDIA,
			List.of(ActionFields.MY_RATING),
			List.of(ActionFields.START_DATE, ActionFields.FINISH_DATE),
			List.of(ActionFields.EPISODES, ActionFields.EPISODES_WATCHED, ActionFields.PRICE),
			Map.of(
					ActionFields.MEDIUM, List.of("Movie", "TV Show", "Book", "Anime", "Documentary", "Other"),
					ActionFields.PLATFORM, List.of("Netflix", "Hulu", "Disney+", "HBO Max", "Amazon Prime Video",
							"Apple TV+", "Paramount+", "Peacock", "Crunchyroll", "YouTube", "Theater",
							"Kindle", "Physical", "Other"))),

	FOOD(Workspace.FOOD,
			List.of(ActionFields.OVERALL_RATING, ActionFields.FOOD_RATING, ActionFields.AMBIANCE_RATING,
					ActionFields.SERVICE_RATING, ActionFields.VALUE_RATING),
			List.of(ActionFields.VISIT_DATE),
			List.of(ActionFields.TOTAL_PRICE),
			Map.of(ActionFields.PRICE_LEVEL, List.of("$", "$$", "$$$", "$$$$")));

	/** Conventional status values; anything else is accepted with a warning. */
	public static final Set<String> STANDARD_STATUSES =
			Set.of("Watching", "Finished", "On Hold", "Dropped", "Plan to Watch", "Planned");

	public static final double MIN_RATING = 0;
	public static final double MAX_RATING = 10;

	private final Workspace workspace;
	private final List<String> ratingFields;
	private final List<String> dateFields;
	private final List<String> nonNegativeFields;
	private final Map<String, List<String>> advisoryValues;

	WorkspaceSchema(Workspace workspace, List<String> ratingFields, List<String> dateFields,
			List<String> nonNegativeFields, Map<String, List<String>> advisoryValues) {
		this.workspace = workspace;
		this.ratingFields = ratingFields;
		this.dateFields = dateFields;
		this.nonNegativeFields = nonNegativeFields;
		this.advisoryValues = advisoryValues;
	}

	public static WorkspaceSchema of(Workspace workspace) {
		return workspace == Workspace.FOOD ? FOOD : MEDIA;
	}

	public Workspace workspace() {
		return workspace;
	}

	public String titleField() {
		return workspace.titleField();
	}

	public List<String> ratingFields() {
		return ratingFields;
	}

	public List<String> dateFields() {
		return dateFields;
	}

	public List<String> nonNegativeFields() {
		return nonNegativeFields;
	}

	/**
	 * Categorical fields with a standard value list, in a stable order.
	 */
	public List<String> advisoryFields() {
		return advisoryValues.keySet().stream().sorted().toList();
	}

	public List<String> standardValues(String field) {
		return advisoryValues.getOrDefault(field, List.of());
	}
}
