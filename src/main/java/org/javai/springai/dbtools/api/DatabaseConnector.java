package org.javai.springai.dbtools.api;

/**
 * Contract every database implementation satisfies so it can be registered with a
 * {@link org.javai.springai.dbtools.registry.DatabaseRegistry} and reached through
 * the execution gateway.
 *
 * <p>A connector owns its connection handling and credentials; the core never looks
 * inside. The name a connector is reachable under is chosen by whoever registers it.</p>
 *
 * <p>Both operations fail immediately with {@link ErrorKind#NOT_IMPLEMENTED} unless
 * overridden, so a misconfigured connector is never mistaken for an empty result.</p>
 */
public interface DatabaseConnector {

	/**
	 * Executes an arbitrary SQL statement.
	 *
	 * @param query the statement text, passed through unmodified
	 * @return rows and column names produced by the statement
	 * @throws DriverException on any failure of the underlying database
	 */
	default ExecuteSqlResult executeSql(String query) {
		throw DatabaseToolException.notImplemented(getClass(), "executeSql");
	}

	/**
	 * Describes all tables visible to this connector.
	 *
	 * @throws DriverException on any failure of the underlying database
	 */
	default SchemaDescription showSchema() {
		throw DatabaseToolException.notImplemented(getClass(), "showSchema");
	}

	/**
	 * Whether mutating statements may run against this connector. Fixed for the
	 * lifetime of the connector; a different policy means registering a new one.
	 */
	default boolean allowWrites() {
		return false;
	}
}
