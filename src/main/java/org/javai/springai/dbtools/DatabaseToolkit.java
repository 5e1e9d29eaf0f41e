package org.javai.springai.dbtools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.javai.springai.dbtools.api.ConfirmationChannel;
import org.javai.springai.dbtools.api.DatabaseConnector;
import org.javai.springai.dbtools.config.DatabaseToolsConfig;
import org.javai.springai.dbtools.config.ProviderSettings;
import org.javai.springai.dbtools.exec.SqlExecutionGateway;
import org.javai.springai.dbtools.exec.WriteAuthorizer;
import org.javai.springai.dbtools.prompt.AvailableDatabasesContributor;
import org.javai.springai.dbtools.registry.DatabaseRegistry;
import org.javai.springai.dbtools.schema.SchemaInspector;
import org.javai.springai.dbtools.tools.DatabaseToolDispatcher;
import org.javai.springai.dbtools.tools.DatabaseTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The database tooling of one process, built once at start-up and handed to whatever
 * needs it. There is no ambient registry: everything reachable from a toolkit shares
 * the registry it was built with.
 *
 * <pre>{@code
 * DatabaseToolkit toolkit = DatabaseToolkit.builder()
 *     .config(DatabaseToolsConfigLoader.load(path).orElseThrow())
 *     .connector("analytics", settings -> JdbcDatabaseConnector.builder(analyticsDs)
 *             .allowWrites(settings.allowWrites())
 *             .build())
 *     .confirmationChannel(message -> ui.ask(message))
 *     .build();
 *
 * chatClient.prompt()
 *     .system(toolkit.contextContributor().describeAvailableResources())
 *     .tools(toolkit.tools())
 *     ...
 * }</pre>
 */
public final class DatabaseToolkit {

	private static final Logger logger = LoggerFactory.getLogger(DatabaseToolkit.class);

	private final DatabaseRegistry registry;
	private final SqlExecutionGateway gateway;
	private final SchemaInspector inspector;
	private final AvailableDatabasesContributor contextContributor;
	private final DatabaseTools tools;
	private final DatabaseToolDispatcher dispatcher;

	private DatabaseToolkit(Builder builder) {
		DatabaseToolsConfig config = builder.config;
		this.registry = config.activation() ? DatabaseRegistry.withActivation() : DatabaseRegistry.create();

		builder.connectors.forEach((name, factory) -> {
			ProviderSettings settings = config.providerSettings(name);
			DatabaseConnector connector = Objects.requireNonNull(factory.apply(settings),
					"connector factory for '" + name + "' returned null");
			registry.register(name, connector);
			if (registry.isActivationEnabled() && settings.enabled()) {
				registry.enable(name);
			}
		});
		config.providers().keySet().stream()
				.filter(name -> !builder.connectors.containsKey(name))
				.forEach(name -> logger.warn("Database '{}' is configured but no connector was supplied", name));

		this.gateway = new SqlExecutionGateway(registry, authorizer(builder.confirmationChannel, config));
		this.inspector = new SchemaInspector(registry);
		this.contextContributor = new AvailableDatabasesContributor(registry);
		this.tools = new DatabaseTools(gateway, inspector);
		this.dispatcher = new DatabaseToolDispatcher(tools);
		logger.info("Database tools ready with databases {}", registry.names());
	}

	public static Builder builder() {
		return new Builder();
	}

	private static WriteAuthorizer authorizer(ConfirmationChannel channel, DatabaseToolsConfig config) {
		if (channel == null) {
			return WriteAuthorizer.flagOnly();
		}
		return WriteAuthorizer.withConfirmation(
				config.confirmationTimeout().map(channel::withTimeout).orElse(channel));
	}

	public DatabaseRegistry registry() {
		return registry;
	}

	public SqlExecutionGateway gateway() {
		return gateway;
	}

	public SchemaInspector inspector() {
		return inspector;
	}

	public AvailableDatabasesContributor contextContributor() {
		return contextContributor;
	}

	public DatabaseTools tools() {
		return tools;
	}

	public DatabaseToolDispatcher dispatcher() {
		return dispatcher;
	}

	public List<String> databaseNames() {
		return registry.names();
	}

	/**
	 * Builder for {@link DatabaseToolkit}.
	 */
	public static final class Builder {
		private DatabaseToolsConfig config = DatabaseToolsConfig.defaults();
		private final Map<String, Function<ProviderSettings, DatabaseConnector>> connectors = new LinkedHashMap<>();
		private ConfirmationChannel confirmationChannel;

		private Builder() {
		}

		public Builder config(DatabaseToolsConfig config) {
			this.config = Objects.requireNonNull(config, "config must not be null");
			return this;
		}

		/**
		 * Adds a connector built from the settings configured for {@code name}
		 * ({@link ProviderSettings#defaults()} when none are configured).
		 */
		public Builder connector(String name, Function<ProviderSettings, DatabaseConnector> factory) {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("name must not be blank");
			}
			connectors.put(name, Objects.requireNonNull(factory, "factory must not be null"));
			return this;
		}

		/**
		 * Adds a connector that was built elsewhere. Its own {@code allowWrites} applies;
		 * only the configured {@code enabled} flag is taken from the settings.
		 */
		public Builder connector(String name, DatabaseConnector connector) {
			Objects.requireNonNull(connector, "connector must not be null");
			return connector(name, settings -> connector);
		}

		/**
		 * Confirms permitted writes with the user. Without a channel, a connector's
		 * {@code allowWrites} flag alone authorizes writes.
		 */
		public Builder confirmationChannel(ConfirmationChannel confirmationChannel) {
			this.confirmationChannel = confirmationChannel;
			return this;
		}

		public DatabaseToolkit build() {
			return new DatabaseToolkit(this);
		}
	}
}
