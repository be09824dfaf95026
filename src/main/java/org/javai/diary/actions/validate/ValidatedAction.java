package org.javai.diary.actions.validate;

import java.util.Objects;
import java.util.Optional;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.catalog.MatchedEntry;

/**
 * An action paired with its verdict and, when resolution succeeded, the entry it refers to.
 *
 * @param action the action, with {@code targetId} filled in when an update/delete resolved
 * @param matchedEntry the resolved catalog entry, or null
 * @param verdict validation outcome
 */
public record ValidatedAction(CatalogAction action, MatchedEntry matchedEntry, ValidationVerdict verdict) {

	public ValidatedAction {
		Objects.requireNonNull(action, "action must not be null");
		Objects.requireNonNull(verdict, "verdict must not be null");
	}

	public boolean isValid() {
		return verdict.valid();
	}

	public Optional<MatchedEntry> match() {
		return Optional.ofNullable(matchedEntry);
	}
}
