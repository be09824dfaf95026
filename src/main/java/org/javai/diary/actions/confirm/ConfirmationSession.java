package org.javai.diary.actions.confirm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import org.javai.diary.actions.api.ActionKind;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.exec.BatchExecutor;
import org.javai.diary.actions.exec.BatchReport;
import org.javai.diary.actions.generate.RejectedAction;
import org.javai.diary.actions.validate.ActionValidator;
import org.javai.diary.actions.validate.ValidatedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Review state for one generated batch: which actions are selected, and any edits the user made.
 *
 * <p>Only valid actions can ever be selected. The session starts with every valid action selected;
 * invalid ones are shown but stay unselectable. Edits are limited to create actions and, unless
 * disabled, re-validate the edited action against the snapshot the batch was validated with.</p>
 *
 * <p>Items the oracle proposed with an unknown type are listed by {@link #rejected()}; they never
 * take part in selection.</p>
 *
 * <p>A session is owned by a single UI flow and is not thread-safe. Once confirmed or cancelled it
 * rejects further changes.</p>
 */
public class ConfirmationSession {

	private static final Logger logger = LoggerFactory.getLogger(ConfirmationSession.class);

	static final String NOTHING_SELECTED = "Select at least one valid action";
	static final String EXECUTION_FAILED = "Failed to execute actions: ";

	private final String intent;
	private final List<ValidatedAction> entries;
	private final List<RejectedAction> rejected;
	private final TreeSet<Integer> selected = new TreeSet<>();
	private final ActionValidator validator;
	private final CatalogSnapshot snapshot;
	private final boolean revalidateOnEdit;
	private ConfirmationState state = ConfirmationState.OPEN;

	public ConfirmationSession(String intent, List<ValidatedAction> actions, List<RejectedAction> rejected,
			ActionValidator validator, CatalogSnapshot snapshot, boolean revalidateOnEdit) {
		this.intent = intent != null ? intent : "";
		this.entries = new ArrayList<>(actions != null ? actions : List.of());
		this.rejected = rejected != null ? List.copyOf(rejected) : List.of();
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
		this.revalidateOnEdit = revalidateOnEdit;
		selectValid();
	}

	public ConfirmationSession(String intent, List<ValidatedAction> actions, ActionValidator validator,
			CatalogSnapshot snapshot, boolean revalidateOnEdit) {
		this(intent, actions, List.of(), validator, snapshot, revalidateOnEdit);
	}

	public ConfirmationSession(String intent, List<ValidatedAction> actions, ActionValidator validator,
			CatalogSnapshot snapshot) {
		this(intent, actions, List.of(), validator, snapshot, true);
	}

	public String intent() {
		return intent;
	}

	public Workspace workspace() {
		return snapshot.workspace();
	}

	public ConfirmationState state() {
		return state;
	}

	public List<ValidatedAction> actions() {
		return List.copyOf(entries);
	}

	public ValidatedAction action(int index) {
		checkIndex(index);
		return entries.get(index);
	}

	public List<RejectedAction> rejected() {
		return rejected;
	}

	public int size() {
		return entries.size();
	}

	/**
	 * @return selected indices in ascending order; never contains an invalid action's index
	 */
	public List<Integer> selectedIndices() {
		return List.copyOf(selected);
	}

	public boolean isSelected(int index) {
		return selected.contains(index);
	}

	public int selectedCount() {
		return selected.size();
	}

	public int validCount() {
		return (int) entries.stream().filter(ValidatedAction::isValid).count();
	}

	public boolean hasWarnings() {
		return entries.stream().anyMatch(entry -> entry.verdict().hasWarnings());
	}

	/**
	 * Flip the selection of one action. Invalid actions are left unselected.
	 *
	 * @throws IndexOutOfBoundsException if there is no action at {@code index}
	 */
	public void toggle(int index) {
		requireOpen();
		checkIndex(index);
		if (!entries.get(index).isValid()) {
			return;
		}
		if (!selected.remove(index)) {
			selected.add(index);
		}
	}

	public void selectAll() {
		requireOpen();
		selectValid();
	}

	private void selectValid() {
		selected.clear();
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i).isValid()) {
				selected.add(i);
			}
		}
	}

	public void deselectAll() {
		requireOpen();
		selected.clear();
	}

	/**
	 * Merge {@code patch} into a create action's payload. A {@code null} value removes the field.
	 * <p>
	 * An action that becomes invalid is deselected. An action that becomes valid is not selected
	 * automatically.
	 *
	 * @return the updated entry
	 * @throws IllegalArgumentException if the action at {@code index} is not a create
	 */
	public ValidatedAction edit(int index, Map<String, ?> patch) {
		requireOpen();
		checkIndex(index);
		ValidatedAction current = entries.get(index);
		if (current.action().kind() != ActionKind.CREATE) {
			throw new IllegalArgumentException("Only create actions can be edited, action " + index
					+ " is " + current.action().kind().wireValue());
		}

		CatalogAction edited = current.action().withPatch(patch);
		ValidatedAction updated = revalidateOnEdit
				? validator.validate(edited, snapshot)
				: new ValidatedAction(edited, current.matchedEntry(), current.verdict());
		entries.set(index, updated);
		if (!updated.isValid()) {
			selected.remove(index);
		}
		return updated;
	}

	/**
	 * Execute the selected valid actions in their original order.
	 * <p>
	 * With nothing selected no executor call is made, the session stays open and the result
	 * carries the reason. An exception from the executor is reported the same way.
	 */
	public ConfirmationResult confirm(BatchExecutor executor) {
		requireOpen();
		Objects.requireNonNull(executor, "executor must not be null");

		List<CatalogAction> approved = new ArrayList<>();
		for (int index : selected) {
			ValidatedAction entry = entries.get(index);
			if (entry.isValid()) {
				approved.add(entry.action());
			}
		}
		if (approved.isEmpty()) {
			logger.debug("Confirm requested with no valid action selected");
			return ConfirmationResult.notExecuted(NOTHING_SELECTED);
		}

		BatchReport report;
		try {
			report = executor.execute(snapshot.workspace(), approved);
		}
		catch (RuntimeException ex) {
			logger.warn("Batch execution failed", ex);
			return ConfirmationResult.notExecuted(EXECUTION_FAILED + ex.getMessage());
		}
		state = ConfirmationState.CONFIRMED;
		return ConfirmationResult.executed(report);
	}

	public void cancel() {
		requireOpen();
		state = ConfirmationState.CANCELLED;
	}

	private void requireOpen() {
		if (state.isTerminal()) {
			throw new IllegalStateException("Confirmation session is " + state);
		}
	}

	private void checkIndex(int index) {
		Objects.checkIndex(index, entries.size());
	}
}
