package org.javai.springai.dbtools.exec;

import java.util.Objects;
import org.javai.springai.dbtools.api.DatabaseConnector;
import org.javai.springai.dbtools.api.ExecuteSqlResult;
import org.javai.springai.dbtools.api.Mutability;
import org.javai.springai.dbtools.registry.DatabaseRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches SQL statements to registered connectors.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Both arguments must be non-blank ({@code INVALID_ARGUMENT}).</li>
 *   <li>The connector is resolved through the registry ({@code NOT_FOUND}, {@code NOT_ENABLED}).</li>
 *   <li>The statement is classified by {@link StatementClassifier}.</li>
 *   <li>Mutating statements pass through the {@link WriteAuthorizer}
 *       ({@code WRITE_NOT_PERMITTED}, {@code USER_REJECTED}).</li>
 *   <li>The connector runs the original statement text; its result is returned as is
 *       ({@code DRIVER_ERROR} on failure).</li>
 * </ol>
 *
 * <p>Calls are independent of each other and may run concurrently; the gateway holds
 * no state beyond its collaborators.</p>
 */
public final class SqlExecutionGateway {

	private static final Logger logger = LoggerFactory.getLogger(SqlExecutionGateway.class);

	private final DatabaseRegistry registry;
	private final WriteAuthorizer authorizer;

	public SqlExecutionGateway(DatabaseRegistry registry) {
		this(registry, WriteAuthorizer.flagOnly());
	}

	public SqlExecutionGateway(DatabaseRegistry registry, WriteAuthorizer authorizer) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.authorizer = Objects.requireNonNull(authorizer, "authorizer must not be null");
	}

	public ExecuteSqlResult executeQuery(String resourceName, String sqlText) {
		ConnectorCalls.requireText(resourceName, "databaseName");
		ConnectorCalls.requireText(sqlText, "sqlQuery");

		DatabaseConnector connector = registry.lookup(resourceName);
		Mutability mutability = StatementClassifier.classify(sqlText);
		logger.debug("Statement for database '{}' classified as {}", resourceName, mutability);

		if (mutability == Mutability.MUTATING) {
			authorizer.authorize(resourceName, connector, sqlText);
			logger.info("Executing authorized write on database '{}'", resourceName);
		}
		return ConnectorCalls.invoke(resourceName, "executeSql", () -> connector.executeSql(sqlText));
	}

	public DatabaseRegistry registry() {
		return registry;
	}
}
