package org.javai.diary.actions.generate;

import org.javai.diary.actions.api.Workspace;

/**
 * Turns a free-text request into a batch of candidate actions.
 *
 * <p>Implementations report oracle problems as {@link GenerationResult.Failure} rather than
 * throwing.</p>
 */
@FunctionalInterface
public interface ActionGenerator {

	GenerationResult generate(String text, Workspace workspace);
}
