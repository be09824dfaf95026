package org.javai.diary.actions.generate;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Raw JSON representation of one oracle-proposed action, before its kind is checked.
 *
 * <p>Example JSON:
 * <pre>
 * { "type": "update", "data": { "title": "Inception", "status": "Finished" } }
 * </pre>
 *
 * @param type the action kind as the oracle wrote it
 * @param id optional identifier the oracle already knows
 * @param data field values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawAction(
		@JsonProperty("type") @JsonAlias("kind") String type,
		@JsonProperty("id") String id,
		@JsonProperty("data") @JsonAlias("payload") Map<String, Object> data
) {
}
