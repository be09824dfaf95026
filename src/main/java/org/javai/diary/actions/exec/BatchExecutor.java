package org.javai.diary.actions.exec;

import java.util.List;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;

/**
 * Applies approved actions to the catalog.
 *
 * <p>Actions run one after another in the given order. A failing action is recorded in the report
 * and does not stop or roll back the others.</p>
 */
public interface BatchExecutor {

	BatchReport execute(Workspace workspace, List<CatalogAction> actions);
}
