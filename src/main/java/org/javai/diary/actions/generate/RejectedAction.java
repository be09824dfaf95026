package org.javai.diary.actions.generate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An oracle-proposed item that could not become a {@link org.javai.diary.actions.api.CatalogAction}.
 * It is reported next to the batch instead of failing it.
 *
 * @param index position in the oracle's action list
 * @param type the type the oracle wrote
 * @param data the item's fields as proposed
 * @param reason message suitable for showing to the user
 */
public record RejectedAction(int index, String type, Map<String, Object> data, String reason) {

	public RejectedAction {
		data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
	}
}
