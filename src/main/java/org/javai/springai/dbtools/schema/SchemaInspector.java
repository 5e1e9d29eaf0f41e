package org.javai.springai.dbtools.schema;

import java.util.Objects;
import org.javai.springai.dbtools.api.DatabaseConnector;
import org.javai.springai.dbtools.api.SchemaDescription;
import org.javai.springai.dbtools.exec.ConnectorCalls;
import org.javai.springai.dbtools.registry.DatabaseRegistry;

/**
 * Resolves a connector and asks it for its schema. Schema inspection is read-only by
 * contract, so no authorization applies.
 */
public final class SchemaInspector {

	private final DatabaseRegistry registry;

	public SchemaInspector(DatabaseRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	public SchemaDescription describeSchema(String resourceName) {
		ConnectorCalls.requireText(resourceName, "databaseName");
		DatabaseConnector connector = registry.lookup(resourceName);
		return ConnectorCalls.invoke(resourceName, "showSchema", connector::showSchema);
	}
}
