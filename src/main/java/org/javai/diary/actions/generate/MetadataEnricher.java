package org.javai.diary.actions.generate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.diary.actions.api.ActionKind;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills create actions with metadata from a {@link MetadataProvider} before they are validated.
 * <p>
 * Fields the oracle supplied always win over looked-up ones. A provider that fails leaves the action
 * as it was; update and delete actions, and creates without a title, are never looked up.
 */
public class MetadataEnricher {

	private static final Logger logger = LoggerFactory.getLogger(MetadataEnricher.class);

	private final MetadataProvider provider;

	public MetadataEnricher(MetadataProvider provider) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
	}

	public List<CatalogAction> enrichAll(Workspace workspace, List<CatalogAction> actions) {
		List<CatalogAction> enriched = new ArrayList<>(actions.size());
		for (CatalogAction action : actions) {
			enriched.add(enrich(workspace, action));
		}
		return enriched;
	}

	public CatalogAction enrich(Workspace workspace, CatalogAction action) {
		if (action.kind() != ActionKind.CREATE || action.title(workspace).filter(t -> !t.isBlank()).isEmpty()) {
			return action;
		}
		Map<String, Object> metadata;
		try {
			metadata = provider.lookup(workspace, action.payload());
		}
		catch (RuntimeException ex) {
			logger.warn("Metadata lookup failed for '{}': {}", action.title(workspace).orElse(""), ex.getMessage());
			return action;
		}
		if (metadata == null || metadata.isEmpty()) {
			return action;
		}
		return action.withPayload(ActionPayload.of(metadata).merge(action.payload().asMap()));
	}
}
