package org.javai.diary.actions.generate;

import java.util.Map;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.Workspace;

/**
 * Looks up catalog metadata (poster, year, genre, plot, ...) for an entry about to be created,
 * typically from an external movie, TV or book service.
 */
@FunctionalInterface
public interface MetadataProvider {

	/**
	 * @param workspace the workspace of the create action
	 * @param fields the fields the oracle proposed, including the title
	 * @return known metadata fields, or an empty map when the entry is unknown
	 */
	Map<String, Object> lookup(Workspace workspace, ActionPayload fields);
}
