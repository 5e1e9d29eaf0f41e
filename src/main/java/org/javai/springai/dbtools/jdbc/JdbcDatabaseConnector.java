package org.javai.springai.dbtools.jdbc;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.javai.springai.dbtools.api.AbstractDatabaseConnector;
import org.javai.springai.dbtools.api.DriverException;
import org.javai.springai.dbtools.api.ExecuteSqlResult;
import org.javai.springai.dbtools.api.SchemaDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connector for any JDBC database reachable through a {@link DataSource}.
 *
 * <p>A connection is borrowed from the data source for each call and closed
 * afterwards. Pooling, if wanted, belongs to the data source; closing the data
 * source belongs to whoever created it.</p>
 *
 * <pre>{@code
 * JdbcDatabaseConnector connector = JdbcDatabaseConnector.builder(dataSource)
 *     .schemaPattern("public")
 *     .allowWrites(false)
 *     .build();
 * registry.register("analytics", connector);
 * }</pre>
 */
public final class JdbcDatabaseConnector extends AbstractDatabaseConnector {

	private static final Logger logger = LoggerFactory.getLogger(JdbcDatabaseConnector.class);

	static final String UPDATE_COUNT = "updateCount";

	private final DataSource dataSource;
	private final String catalog;
	private final String schemaPattern;

	private JdbcDatabaseConnector(Builder builder) {
		super(builder.allowWrites);
		this.dataSource = builder.dataSource;
		this.catalog = builder.catalog;
		this.schemaPattern = builder.schemaPattern;
	}

	public static Builder builder(DataSource dataSource) {
		return new Builder(dataSource);
	}

	@Override
	public ExecuteSqlResult executeSql(String query) {
		try (Connection connection = dataSource.getConnection();
				Statement statement = connection.createStatement()) {
			if (statement.execute(query)) {
				try (ResultSet resultSet = statement.getResultSet()) {
					return readResultSet(resultSet);
				}
			}
			return ExecuteSqlResult.updateCount(statement.getUpdateCount());
		}
		catch (SQLException e) {
			logger.debug("Statement failed: {}", e.getMessage());
			throw new DriverException(e.getMessage(), e);
		}
	}

	@Override
	public SchemaDescription showSchema() {
		try (Connection connection = dataSource.getConnection()) {
			DatabaseMetaData metaData = connection.getMetaData();
			List<TableRef> tables = new ArrayList<>();
			try (ResultSet rs = metaData.getTables(catalog, schemaPattern, "%", new String[] { "TABLE" })) {
				while (rs.next()) {
					tables.add(new TableRef(rs.getString("TABLE_CAT"), rs.getString("TABLE_SCHEM"),
							rs.getString("TABLE_NAME")));
				}
			}
			Map<String, Long> occurrences = tables.stream()
					.collect(Collectors.groupingBy(TableRef::name, Collectors.counting()));
			String escape = metaData.getSearchStringEscape();

			Map<String, String> definitions = new LinkedHashMap<>();
			for (TableRef table : tables) {
				// a name found in several schemas (or catalogs) is qualified so the entries stay apart
				String key = occurrences.get(table.name()) > 1 && table.qualifier() != null
						? table.qualifier() + "." + table.name()
						: table.name();
				definitions.put(key, describeTable(metaData, table, key, escape));
			}
			return new SchemaDescription(definitions);
		}
		catch (SQLException e) {
			logger.debug("Schema lookup failed: {}", e.getMessage());
			throw new DriverException(e.getMessage(), e);
		}
	}

	private String describeTable(DatabaseMetaData metaData, TableRef table, String displayName, String escape)
			throws SQLException {
		StringJoiner columns = new StringJoiner(",\n  ", "CREATE TABLE " + displayName + " (\n  ", "\n)");
		String tableCatalog = table.catalog() != null ? table.catalog() : catalog;
		String tableSchema = table.schema() != null ? escapePattern(table.schema(), escape) : schemaPattern;
		try (ResultSet rs = metaData.getColumns(tableCatalog, tableSchema, escapePattern(table.name(), escape), "%")) {
			while (rs.next()) {
				StringBuilder column = new StringBuilder()
						.append(rs.getString("COLUMN_NAME"))
						.append(' ')
						.append(rs.getString("TYPE_NAME"));
				if ("NO".equals(rs.getString("IS_NULLABLE"))) {
					column.append(" NOT NULL");
				}
				columns.add(column);
			}
		}
		return columns.toString();
	}

	/**
	 * Metadata lookups take LIKE patterns; a literal name has its wildcards escaped.
	 */
	static String escapePattern(String name, String escape) {
		if (escape == null || escape.isEmpty()) {
			return name;
		}
		StringBuilder escaped = new StringBuilder(name.length());
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c == '_' || c == '%' || escape.indexOf(c) >= 0) {
				escaped.append(escape);
			}
			escaped.append(c);
		}
		return escaped.toString();
	}

	private static ExecuteSqlResult readResultSet(ResultSet resultSet) throws SQLException {
		ResultSetMetaData metaData = resultSet.getMetaData();
		int columnCount = metaData.getColumnCount();
		List<String> fields = new ArrayList<>(columnCount);
		Set<String> taken = new HashSet<>();
		for (int i = 1; i <= columnCount; i++) {
			fields.add(uniqueLabel(metaData.getColumnLabel(i), taken));
		}

		List<Map<String, Object>> rows = new ArrayList<>();
		while (resultSet.next()) {
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 1; i <= columnCount; i++) {
				row.put(fields.get(i - 1), normalize(resultSet.getObject(i)));
			}
			rows.add(row);
		}
		return new ExecuteSqlResult(rows, fields);
	}

	/**
	 * Repeated labels, as in {@code SELECT a.id, b.id}, become {@code id}, {@code id_2}, ...
	 */
	static String uniqueLabel(String label, Set<String> taken) {
		String candidate = label;
		for (int n = 2; !taken.add(candidate); n++) {
			candidate = label + "_" + n;
		}
		return candidate;
	}

	/**
	 * Results carry strings, numbers and nulls only.
	 */
	static Object normalize(Object value) {
		if (value == null || value instanceof String || value instanceof Number) {
			return value;
		}
		if (value instanceof byte[] bytes) {
			return Base64.getEncoder().encodeToString(bytes);
		}
		return value.toString();
	}

	private record TableRef(String catalog, String schema, String name) {

		String qualifier() {
			return schema != null ? schema : catalog;
		}
	}

	/**
	 * Builder for {@link JdbcDatabaseConnector}.
	 */
	public static final class Builder {
		private final DataSource dataSource;
		private boolean allowWrites = false;
		private String catalog;
		private String schemaPattern;

		private Builder(DataSource dataSource) {
			this.dataSource = Objects.requireNonNull(dataSource, "JdbcDatabaseConnector requires a data source");
		}

		/**
		 * Whether mutating statements may run. Defaults to {@code false}.
		 */
		public Builder allowWrites(boolean allowWrites) {
			this.allowWrites = allowWrites;
			return this;
		}

		/**
		 * Catalog to describe in {@link JdbcDatabaseConnector#showSchema()}; {@code null} means any.
		 */
		public Builder catalog(String catalog) {
			this.catalog = catalog;
			return this;
		}

		/**
		 * Schema name pattern to describe in {@link JdbcDatabaseConnector#showSchema()};
		 * {@code null} means any.
		 */
		public Builder schemaPattern(String schemaPattern) {
			this.schemaPattern = schemaPattern;
			return this;
		}

		public JdbcDatabaseConnector build() {
			return new JdbcDatabaseConnector(this);
		}
	}
}
