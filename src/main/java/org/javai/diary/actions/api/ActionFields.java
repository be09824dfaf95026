package org.javai.diary.actions.api;

/**
 * Payload field names shared by the oracle prompt, the validator and the store.
 * Names match the catalog column names.
 */
public final class ActionFields {

	// Media
	public static final String TITLE = "title";
	public static final String MEDIUM = "medium";
	public static final String TYPE = "type";
	public static final String STATUS = "status";
	public static final String GENRE = "genre";
	public static final String PLATFORM = "platform";
	public static final String MY_RATING = "my_rating";
	public static final String START_DATE = "start_date";
	public static final String FINISH_DATE = "finish_date";
	public static final String LANGUAGE = "language";
	public static final String EPISODES = "episodes";
	public static final String EPISODES_WATCHED = "episodes_watched";
	public static final String PRICE = "price";
	public static final String POSTER_URL = "poster_url";
	public static final String IMDB_ID = "imdb_id";
	public static final String AVERAGE_RATING = "average_rating";
	public static final String YEAR = "year";
	public static final String PLOT = "plot";
	public static final String SEASON = "season";
	public static final String LENGTH = "length";

	// Food
	public static final String NAME = "name";
	public static final String VISIT_DATE = "visit_date";
	public static final String CATEGORY = "category";
	public static final String OVERALL_RATING = "overall_rating";
	public static final String FOOD_RATING = "food_rating";
	public static final String AMBIANCE_RATING = "ambiance_rating";
	public static final String SERVICE_RATING = "service_rating";
	public static final String VALUE_RATING = "value_rating";
	public static final String TOTAL_PRICE = "total_price";
	public static final String PRICE_LEVEL = "price_level";
	public static final String CUISINE_TYPE = "cuisine_type";
	public static final String DINING_TYPE = "dining_type";
	public static final String TAGS = "tags";
	public static final String WOULD_RETURN = "would_return";
	public static final String NOTES = "notes";

	private ActionFields() {
	}
}
