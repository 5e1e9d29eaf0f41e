package org.javai.springai.dbtools.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.springai.dbtools.api.DatabaseConnector;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name-keyed store of {@link DatabaseConnector}s.
 *
 * <p>Names are unique and case-sensitive. Registering a name twice replaces the
 * earlier connector.</p>
 *
 * <h2>Activation</h2>
 *
 * <p>A registry created with {@link #withActivation()} separates <em>known</em>
 * resources from <em>usable</em> ones: a host can register every configured database
 * up front and expose only some of them to a given session with {@link #enable(String...)}.
 * Lookups of registered but inactive names fail with
 * {@link org.javai.springai.dbtools.api.ErrorKind#NOT_ENABLED}.</p>
 *
 * <pre>{@code
 * DatabaseRegistry registry = DatabaseRegistry.withActivation();
 * registry.register("analytics", analytics);
 * registry.register("billing", billing);
 * registry.enable("analytics");
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Lookups and listings are safe from any number of threads. Registration and
 * activation are meant for a single-threaded setup phase; callers that mutate the
 * registry afterwards must serialize those calls themselves.</p>
 */
public final class DatabaseRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DatabaseRegistry.class);

	private final Map<String, DatabaseConnector> connectors = new ConcurrentHashMap<>();
	private final Set<String> active;

	private DatabaseRegistry(boolean activation) {
		this.active = activation ? ConcurrentHashMap.newKeySet() : null;
	}

	/**
	 * Creates a registry in which every registered connector is usable.
	 */
	public static DatabaseRegistry create() {
		return new DatabaseRegistry(false);
	}

	/**
	 * Creates a registry in which connectors must be enabled before they can be looked up.
	 */
	public static DatabaseRegistry withActivation() {
		return new DatabaseRegistry(true);
	}

	public boolean isActivationEnabled() {
		return active != null;
	}

	/**
	 * Registers {@code connector} under {@code name}, replacing any earlier registration.
	 *
	 * @return this registry for fluent setup
	 */
	public DatabaseRegistry register(String name, DatabaseConnector connector) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		Objects.requireNonNull(connector, "connector must not be null");
		DatabaseConnector previous = connectors.put(name, connector);
		if (previous != null && previous != connector) {
			logger.warn("Database '{}' re-registered; {} replaces {}", name,
					connector.getClass().getSimpleName(), previous.getClass().getSimpleName());
		}
		else {
			logger.debug("Registered database '{}' ({}, allowWrites={})", name,
					connector.getClass().getSimpleName(), connector.allowWrites());
		}
		return this;
	}

	/**
	 * Marks each name as active. Either every name is activated or, when one of them
	 * is not registered, none is.
	 *
	 * @throws DatabaseToolException of kind {@code UNKNOWN_RESOURCE} for a name that was never registered
	 * @throws IllegalStateException if this registry was created without activation
	 */
	public DatabaseRegistry enable(String... names) {
		if (active == null) {
			throw new IllegalStateException("Registry was created without activation; use DatabaseRegistry.withActivation()");
		}
		for (String name : names) {
			if (name == null || !connectors.containsKey(name)) {
				throw DatabaseToolException.unknownResource(name);
			}
		}
		for (String name : names) {
			if (active.add(name)) {
				logger.debug("Enabled database '{}'", name);
			}
		}
		return this;
	}

	/**
	 * Resolves the connector registered under {@code name}.
	 *
	 * @throws DatabaseToolException of kind {@code NOT_FOUND} for an unknown name, or
	 * {@code NOT_ENABLED} for a registered name that has not been enabled
	 */
	public DatabaseConnector lookup(String name) {
		DatabaseConnector connector = name != null ? connectors.get(name) : null;
		if (connector == null) {
			throw DatabaseToolException.notFound(name);
		}
		if (active != null && !active.contains(name)) {
			throw DatabaseToolException.notEnabled(name);
		}
		return connector;
	}

	public boolean isRegistered(String name) {
		return name != null && connectors.containsKey(name);
	}

	/**
	 * Names available to callers: every registered name, or only the enabled ones
	 * when activation is in use. Sorted, so the listing is stable for a given state.
	 */
	public List<String> names() {
		List<String> names = new ArrayList<>(active != null ? active : connectors.keySet());
		names.sort(null);
		return List.copyOf(names);
	}
}
