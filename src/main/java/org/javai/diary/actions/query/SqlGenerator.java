package org.javai.diary.actions.query;

import org.javai.diary.actions.api.Workspace;

/**
 * Turns a free-text analytics question into SQL over the workspace's table.
 */
@FunctionalInterface
public interface SqlGenerator {

	/**
	 * @throws GenerationException if the oracle fails or its answer cannot be read
	 */
	SqlGeneration generate(String text, Workspace workspace);
}
