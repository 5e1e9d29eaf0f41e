package org.javai.springai.dbtools.prompt;

import java.util.List;
import java.util.Optional;
import org.javai.springai.dbtools.registry.DatabaseRegistry;

/**
 * Lists the databases reachable through the database tools so the model knows which
 * names it may pass as {@code databaseName}.
 *
 * <p>By default it reads the registry it was built with; if absent, it looks for a
 * {@link DatabaseRegistry} under the context key {@value #CONTEXT_KEY} in the
 * {@link PromptContext}.</p>
 *
 * <p>The listing is never empty: with no databases available the contribution says so
 * explicitly, so downstream consumers need no special case.</p>
 */
public final class AvailableDatabasesContributor implements PromptContributor {

	public static final String CONTEXT_KEY = "databases";

	static final String HEADER = "/* These are the databases available for the database tool */:";
	static final String NONE_AVAILABLE = "No databases are available for the database tool.";

	private final DatabaseRegistry registry;

	/**
	 * @param registry the registry to list, or {@code null} to read one from the
	 * {@link PromptContext} under {@value #CONTEXT_KEY} on each contribution; without
	 * either, the contribution reports that no databases are available
	 */
	public AvailableDatabasesContributor(DatabaseRegistry registry) {
		this.registry = registry;
	}

	@Override
	public Optional<String> contribute(PromptContext context) {
		DatabaseRegistry effectiveRegistry = registry != null ? registry
				: context != null
						? context.contextFor(CONTEXT_KEY)
								.filter(DatabaseRegistry.class::isInstance)
								.map(DatabaseRegistry.class::cast)
								.orElse(null)
						: null;
		return Optional.of(render(effectiveRegistry != null ? effectiveRegistry.names() : List.of()));
	}

	/**
	 * Human-readable listing of the registry's current names (active names when
	 * activation is in use).
	 */
	public String describeAvailableResources() {
		return render(registry != null ? registry.names() : List.of());
	}

	private static String render(List<String> names) {
		if (names.isEmpty()) {
			return NONE_AVAILABLE;
		}
		StringBuilder sb = new StringBuilder(HEADER);
		for (String name : names) {
			sb.append("\n- ").append(name);
		}
		return sb.toString();
	}
}
