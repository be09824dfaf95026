package org.javai.diary.actions.generate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;

/**
 * Raw JSON representation of the oracle's answer in action mode.
 *
 * <p>Example JSON:
 * <pre>
 * {
 *   "intent": "Add Dune and mark Inception as finished",
 *   "actions": [
 *     { "type": "create", "data": { "title": "Dune", "medium": "Movie" } },
 *     { "type": "update", "data": { "title": "Inception", "status": "Finished" } }
 *   ]
 * }
 * </pre>
 *
 * @param intent short human-readable summary of what the batch does
 * @param actions the proposed actions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawActionBatch(
		@JsonProperty("intent") String intent,
		@JsonProperty("actions") List<RawAction> actions
) {

	public static RawActionBatch fromJson(String json, ObjectMapper mapper) throws JsonProcessingException {
		return mapper.readValue(json, RawActionBatch.class);
	}
}
