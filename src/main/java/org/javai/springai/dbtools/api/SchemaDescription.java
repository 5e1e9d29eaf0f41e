package org.javai.springai.dbtools.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema of the tables visible to a connector: table name to definition, typically
 * a {@code CREATE TABLE} statement.
 *
 * @param tables table definitions in the order the connector reported them
 */
public record SchemaDescription(Map<String, String> tables) {

	public SchemaDescription {
		Objects.requireNonNull(tables, "tables must not be null");
		Map<String, String> copy = new LinkedHashMap<>();
		tables.forEach((name, definition) -> {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("table name must not be blank");
			}
			copy.put(name, Objects.requireNonNull(definition, "definition of table " + name + " must not be null"));
		});
		tables = Collections.unmodifiableMap(copy);
	}

	public static SchemaDescription empty() {
		return new SchemaDescription(Map.of());
	}

	public Optional<String> definition(String tableName) {
		return Optional.ofNullable(tables.get(tableName));
	}

	public List<String> tableNames() {
		return List.copyOf(tables.keySet());
	}

	public boolean isEmpty() {
		return tables.isEmpty();
	}
}
