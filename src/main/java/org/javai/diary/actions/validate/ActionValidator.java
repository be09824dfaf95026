package org.javai.diary.actions.validate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.javai.diary.actions.api.ActionFields;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.catalog.CatalogEntry;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.catalog.MatchedEntry;
import org.javai.diary.actions.resolve.EntityResolver;
import org.javai.diary.actions.resolve.RankedEntityResolver;
import org.javai.diary.actions.resolve.TitleNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks candidate actions against field rules and against the catalog snapshot.
 *
 * <p>Every rule runs, so a verdict lists all problems at once. Messages appear in rule order:</p>
 * <ol>
 *   <li>the title field is present and non-blank</li>
 *   <li>update/delete resolve to an existing entry; a create that resolves is flagged as a possible duplicate</li>
 *   <li>rating fields lie within [0, 10]</li>
 *   <li>status is one of the standard values (warning)</li>
 *   <li>date fields are ISO calendar dates</li>
 *   <li>counts and prices are non-negative numbers</li>
 *   <li>categorical fields use standard values (warning)</li>
 * </ol>
 *
 * <p>Validation never mutates the catalog. The only change applied to the action is filling in
 * {@code targetId} for a resolved update/delete.</p>
 */
public class ActionValidator {

	private static final Logger logger = LoggerFactory.getLogger(ActionValidator.class);

	private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

	static final String MISSING_TITLE = "Missing title";
	static final String NO_MATCH = "No matching diary entry found";

	private final EntityResolver resolver;

	public ActionValidator() {
		this(new RankedEntityResolver());
	}

	public ActionValidator(EntityResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	public List<ValidatedAction> validateAll(List<CatalogAction> actions, CatalogSnapshot snapshot) {
		if (actions == null || actions.isEmpty()) {
			return List.of();
		}
		List<ValidatedAction> validated = new ArrayList<>(actions.size());
		for (CatalogAction action : actions) {
			validated.add(validate(action, snapshot));
		}
		return List.copyOf(validated);
	}

	public ValidatedAction validate(CatalogAction action, CatalogSnapshot snapshot) {
		Objects.requireNonNull(action, "action must not be null");
		Objects.requireNonNull(snapshot, "snapshot must not be null");

		WorkspaceSchema schema = WorkspaceSchema.of(snapshot.workspace());
		List<String> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();

		Optional<String> title = action.title(snapshot.workspace()).filter(StringUtils::isNotBlank);
		if (title.isEmpty()) {
			errors.add(MISSING_TITLE);
		}

		CatalogAction checked = action;
		MatchedEntry match = title.flatMap(t -> findMatch(action, t, snapshot)).orElse(null);
		if (action.kind().targetsExistingEntry()) {
			if (match == null) {
				errors.add(NO_MATCH);
			}
			else {
				checked = action.withTargetId(match.id());
			}
		}
		else if (match != null) {
			warnings.add("Similar title already exists: " + match.title());
		}

		checkRatings(action, schema, errors);
		checkStatus(action, warnings);
		checkDates(action, schema, errors);
		checkNonNegative(action, schema, errors);
		checkAdvisoryValues(action, schema, warnings);

		ValidationVerdict verdict = ValidationVerdict.of(errors, warnings);
		if (logger.isDebugEnabled()) {
			logger.debug("Validated {} '{}': errors={}, warnings={}", action.kind().wireValue(),
					title.orElse(""), verdict.errors(), verdict.warnings());
		}
		return new ValidatedAction(checked, match, verdict);
	}

	/**
	 * The title always decides. A target id is kept only when it names a snapshot row that the title
	 * also qualifies for; an id naming some other row leaves the action unmatched. An id outside the
	 * snapshot is replaced by the title's match.
	 */
	private Optional<MatchedEntry> findMatch(CatalogAction action, String title, CatalogSnapshot snapshot) {
		if (action.kind().targetsExistingEntry() && action.targetId() != null) {
			Optional<CatalogEntry> byId = snapshot.findById(action.targetId());
			if (byId.isPresent()) {
				boolean titleAgrees = TitleNormalizer.qualifies(
						TitleNormalizer.normalize(byId.get().title()), TitleNormalizer.normalize(title));
				return titleAgrees ? byId.map(CatalogEntry::toMatch) : Optional.empty();
			}
		}
		return resolver.resolve(title, snapshot);
	}

	private void checkRatings(CatalogAction action, WorkspaceSchema schema, List<String> errors) {
		for (String field : schema.ratingFields()) {
			action.payload().get(field).ifPresent(value -> {
				Optional<BigDecimal> number = numericValue(value);
				boolean inRange = number
						.map(BigDecimal::doubleValue)
						.filter(n -> n >= WorkspaceSchema.MIN_RATING && n <= WorkspaceSchema.MAX_RATING)
						.isPresent();
				if (!inRange) {
					errors.add(field + " must be between 0 and 10");
				}
			});
		}
	}

	private void checkStatus(CatalogAction action, List<String> warnings) {
		action.payload().text(ActionFields.STATUS)
				.filter(status -> !WorkspaceSchema.STANDARD_STATUSES.contains(status))
				.ifPresent(status -> warnings.add("Non-standard status: " + status));
	}

	private void checkDates(CatalogAction action, WorkspaceSchema schema, List<String> errors) {
		for (String field : schema.dateFields()) {
			action.payload().text(field).ifPresent(value -> {
				if (!isIsoDate(value)) {
					errors.add("Invalid " + field + " format: " + value + ". Use YYYY-MM-DD");
				}
			});
		}
	}

	private void checkNonNegative(CatalogAction action, WorkspaceSchema schema, List<String> errors) {
		for (String field : schema.nonNegativeFields()) {
			action.payload().get(field).ifPresent(value -> {
				boolean ok = numericValue(value).filter(n -> n.signum() >= 0).isPresent();
				if (!ok) {
					errors.add(field + " must be a non-negative number, got: " + value);
				}
			});
		}
	}

	private void checkAdvisoryValues(CatalogAction action, WorkspaceSchema schema, List<String> warnings) {
		for (String field : schema.advisoryFields()) {
			List<String> standard = schema.standardValues(field);
			action.payload().text(field)
					.filter(value -> !standard.contains(value))
					.ifPresent(value -> warnings.add(advisoryMessage(field, value, standard)));
		}
	}

	private static String advisoryMessage(String field, String value, List<String> standard) {
		return switch (field) {
			case ActionFields.MEDIUM -> "Invalid medium: " + value + ". Must be one of: " + String.join(", ", standard);
			case ActionFields.PLATFORM -> "Platform '" + value + "' is not in the standard list";
			default -> "Non-standard " + field + ": " + value;
		};
	}

	static boolean isIsoDate(String value) {
		if (!ISO_DATE.matcher(value).matches()) {
			return false;
		}
		try {
			LocalDate.parse(value);
			return true;
		}
		catch (DateTimeParseException e) {
			return false;
		}
	}

	/**
	 * Numbers and numeric strings (the oracle sometimes quotes them) are both accepted.
	 */
	static Optional<BigDecimal> numericValue(Object value) {
		if (value instanceof Number number) {
			double d = number.doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return Optional.empty();
			}
			return Optional.of(new BigDecimal(number.toString()));
		}
		if (value instanceof String text && NumberUtils.isCreatable(text.trim())) {
			try {
				return Optional.of(new BigDecimal(text.trim()));
			}
			catch (NumberFormatException e) {
				return Optional.empty();
			}
		}
		return Optional.empty();
	}
}
