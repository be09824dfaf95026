package org.javai.diary.actions;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import org.javai.diary.actions.catalog.CatalogSnapshot;
import org.javai.diary.actions.query.QueryExecutor;
import org.javai.diary.actions.resolve.EntityResolver;
import org.javai.diary.actions.resolve.RankedEntityResolver;
import org.javai.diary.actions.resolve.RecencyEntityResolver;
import org.yaml.snakeyaml.Yaml;

/**
 * Tunables of the diary assistant.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * AssistantConfig config = AssistantConfig.defaults();
 *
 * // Bundled diary-assistant.yml
 * AssistantConfig config = AssistantConfig.load();
 * }</pre>
 *
 * <p>YAML keys:</p>
 * <pre>
 * catalog-window: 500        # recent entries searched when resolving titles
 * resolver: ranked           # ranked | recency
 * revalidate-on-edit: true   # re-run validation when a create action is edited
 * max-result-rows: 1000      # rows kept from an analytics query
 * </pre>
 *
 * @param catalogWindow number of recent entries in a catalog snapshot
 * @param resolver resolution policy
 * @param revalidateOnEdit whether edited actions are validated again
 * @param maxResultRows rows kept from an analytics query
 */
public record AssistantConfig(
		int catalogWindow,
		ResolverPolicy resolver,
		boolean revalidateOnEdit,
		int maxResultRows
) {

	public static final String DEFAULT_RESOURCE = "diary-assistant.yml";

	public AssistantConfig {
		if (catalogWindow <= 0) {
			throw new IllegalArgumentException("catalogWindow must be positive");
		}
		if (maxResultRows <= 0) {
			throw new IllegalArgumentException("maxResultRows must be positive");
		}
		resolver = resolver != null ? resolver : ResolverPolicy.RANKED;
	}

	public static AssistantConfig defaults() {
		return new AssistantConfig(CatalogSnapshot.DEFAULT_WINDOW, ResolverPolicy.RANKED, true,
				QueryExecutor.DEFAULT_MAX_ROWS);
	}

	/**
	 * Load {@value #DEFAULT_RESOURCE} from the classpath, falling back to {@link #defaults()} when absent.
	 */
	public static AssistantConfig load() {
		ClassLoader loader = AssistantConfig.class.getClassLoader();
		try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			return in != null ? fromYaml(in) : defaults();
		}
		catch (IOException e) {
			throw new AssistantConfigException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	/**
	 * Read configuration from YAML. Missing keys keep their default.
	 */
	public static AssistantConfig fromYaml(InputStream inputStream) {
		Map<String, Object> data;
		try {
			data = new Yaml().load(inputStream);
		}
		catch (RuntimeException e) {
			throw new AssistantConfigException("Failed to parse assistant configuration", e);
		}
		return fromMap(data);
	}

	static AssistantConfig fromMap(Map<String, Object> data) {
		AssistantConfig defaults = defaults();
		if (data == null) {
			return defaults;
		}
		try {
			return new AssistantConfig(
					intValue(data, "catalog-window", defaults.catalogWindow()),
					data.containsKey("resolver")
							? ResolverPolicy.fromValue(String.valueOf(data.get("resolver")))
							: defaults.resolver(),
					boolValue(data, "revalidate-on-edit", defaults.revalidateOnEdit()),
					intValue(data, "max-result-rows", defaults.maxResultRows()));
		}
		catch (IllegalArgumentException e) {
			throw new AssistantConfigException("Invalid assistant configuration: " + e.getMessage(), e);
		}
	}

	private static int intValue(Map<String, Object> data, String key, int fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be an integer, got: " + value, e);
		}
	}

	private static boolean boolValue(Map<String, Object> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean bool) {
			return bool;
		}
		return Boolean.parseBoolean(value.toString().trim());
	}

	/**
	 * Which {@link EntityResolver} the assistant uses.
	 */
	public enum ResolverPolicy {
		/** First qualifying entry, newest first. */
		RECENCY,
		/** Exact over substring, then closest title, then newest. */
		RANKED;

		public EntityResolver create() {
			return this == RECENCY ? new RecencyEntityResolver() : new RankedEntityResolver();
		}

		static ResolverPolicy fromValue(String value) {
			try {
				return valueOf(value.trim().toUpperCase(Locale.ROOT));
			}
			catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Unknown resolver: " + value, e);
			}
		}
	}
}
