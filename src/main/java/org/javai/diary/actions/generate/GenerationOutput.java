package org.javai.diary.actions.generate;

import java.util.List;
import org.javai.diary.actions.api.CatalogAction;

/**
 * Typed oracle output: a batch summary, the candidate actions in the order proposed, and the items
 * that were dropped because their type is not an action kind.
 */
public record GenerationOutput(String intent, List<CatalogAction> actions, List<RejectedAction> rejected) {

	public GenerationOutput {
		intent = intent != null ? intent : "";
		actions = actions != null ? List.copyOf(actions) : List.of();
		rejected = rejected != null ? List.copyOf(rejected) : List.of();
	}

	public GenerationOutput(String intent, List<CatalogAction> actions) {
		this(intent, actions, List.of());
	}
}
