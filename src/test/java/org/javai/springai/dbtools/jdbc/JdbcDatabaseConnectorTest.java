package org.javai.springai.dbtools.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.springai.dbtools.testsupport.Failures.expectFailure;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.sql.DataSource;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.javai.springai.dbtools.api.ErrorKind;
import org.javai.springai.dbtools.api.ExecuteSqlResult;
import org.javai.springai.dbtools.api.SchemaDescription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcDatabaseConnector")
class JdbcDatabaseConnectorTest {

	@Mock
	private DataSource dataSource;

	@Mock
	private Connection connection;

	@Mock
	private Statement statement;

	@Mock
	private ResultSet resultSet;

	@Mock
	private ResultSetMetaData resultSetMetaData;

	@Mock
	private DatabaseMetaData metaData;

	@Mock
	private ResultSet tables;

	@Mock
	private ResultSet columns;

	@Mock
	private ResultSet otherColumns;

	@Nested
	@DisplayName("executeSql")
	class ExecuteSql {

		@BeforeEach
		void setUp() throws SQLException {
			when(dataSource.getConnection()).thenReturn(connection);
			when(connection.createStatement()).thenReturn(statement);
		}

		@Test
		@DisplayName("reads columns by label and normalizes values")
		void readsResultSet() throws SQLException {
			when(statement.execute("SELECT id, amount, born FROM people")).thenReturn(true);
			when(statement.getResultSet()).thenReturn(resultSet);
			when(resultSet.getMetaData()).thenReturn(resultSetMetaData);
			when(resultSetMetaData.getColumnCount()).thenReturn(3);
			when(resultSetMetaData.getColumnLabel(1)).thenReturn("id");
			when(resultSetMetaData.getColumnLabel(2)).thenReturn("amount");
			when(resultSetMetaData.getColumnLabel(3)).thenReturn("born");
			when(resultSet.next()).thenReturn(true, false);
			when(resultSet.getObject(1)).thenReturn(7);
			when(resultSet.getObject(2)).thenReturn(new BigDecimal("12.50"));
			when(resultSet.getObject(3)).thenReturn(Date.valueOf("1990-04-01"));

			ExecuteSqlResult result = JdbcDatabaseConnector.builder(dataSource).build()
					.executeSql("SELECT id, amount, born FROM people");

			assertThat(result.fields()).containsExactly("id", "amount", "born");
			assertThat(result.rows()).containsExactly(
					Map.of("id", 7, "amount", new BigDecimal("12.50"), "born", "1990-04-01"));
			verify(resultSet).close();
			verify(statement).close();
			verify(connection).close();
		}

		@Test
		@DisplayName("keeps every column when labels repeat")
		void repeatedLabels() throws SQLException {
			when(statement.execute("SELECT a.id, b.id FROM a JOIN b ON a.ref = b.id")).thenReturn(true);
			when(statement.getResultSet()).thenReturn(resultSet);
			when(resultSet.getMetaData()).thenReturn(resultSetMetaData);
			when(resultSetMetaData.getColumnCount()).thenReturn(2);
			when(resultSetMetaData.getColumnLabel(1)).thenReturn("id");
			when(resultSetMetaData.getColumnLabel(2)).thenReturn("id");
			when(resultSet.next()).thenReturn(true, false);
			when(resultSet.getObject(1)).thenReturn(1);
			when(resultSet.getObject(2)).thenReturn(2);

			ExecuteSqlResult result = JdbcDatabaseConnector.builder(dataSource).build()
					.executeSql("SELECT a.id, b.id FROM a JOIN b ON a.ref = b.id");

			assertThat(result.fields()).containsExactly("id", "id_2");
			assertThat(result.rows()).containsExactly(Map.of("id", 1, "id_2", 2));
		}

		@Test
		@DisplayName("reports the update count of a statement without a result set")
		void updateCount() throws SQLException {
			when(statement.execute("DELETE FROM people")).thenReturn(false);
			when(statement.getUpdateCount()).thenReturn(4);

			ExecuteSqlResult result = JdbcDatabaseConnector.builder(dataSource).allowWrites(true).build()
					.executeSql("DELETE FROM people");

			assertThat(result.rows()).containsExactly(Map.of(JdbcDatabaseConnector.UPDATE_COUNT, 4));
		}

		@Test
		@DisplayName("maps SQL failures to DRIVER_ERROR with the driver message")
		void sqlFailure() throws SQLException {
			SQLException syntax = new SQLException("syntax error at or near \"SELEC\"");
			when(statement.execute(any())).thenThrow(syntax);

			DatabaseToolException failure = expectFailure(ErrorKind.DRIVER_ERROR,
					() -> JdbcDatabaseConnector.builder(dataSource).build().executeSql("SELEC 1"));

			assertThat(failure.getMessage()).isEqualTo("syntax error at or near \"SELEC\"");
			assertThat(failure.getCause()).isSameAs(syntax);
			verify(connection).close();
		}
	}

	@Nested
	@DisplayName("showSchema")
	class ShowSchema {

		@BeforeEach
		void setUp() throws SQLException {
			when(dataSource.getConnection()).thenReturn(connection);
		}

		@Test
		@DisplayName("renders a CREATE TABLE statement per table")
		void rendersTables() throws SQLException {
			when(connection.getMetaData()).thenReturn(metaData);
			when(metaData.getTables(isNull(), eq("public"), eq("%"), any())).thenReturn(tables);
			when(tables.next()).thenReturn(true, false);
			when(tables.getString("TABLE_CAT")).thenReturn(null);
			when(tables.getString("TABLE_SCHEM")).thenReturn("public");
			when(tables.getString("TABLE_NAME")).thenReturn("users");
			when(metaData.getSearchStringEscape()).thenReturn("\\");
			when(metaData.getColumns(null, "public", "users", "%")).thenReturn(columns);
			when(columns.next()).thenReturn(true, true, false);
			when(columns.getString("COLUMN_NAME")).thenReturn("id", "email");
			when(columns.getString("TYPE_NAME")).thenReturn("INTEGER", "VARCHAR");
			when(columns.getString("IS_NULLABLE")).thenReturn("NO", "YES");

			SchemaDescription schema = JdbcDatabaseConnector.builder(dataSource)
					.schemaPattern("public")
					.build()
					.showSchema();

			assertThat(schema.tableNames()).containsExactly("users");
			assertThat(schema.definition("users")).contains("""
					CREATE TABLE users (
					  id INTEGER NOT NULL,
					  email VARCHAR
					)""");
			verify(connection).close();
		}

		@Test
		@DisplayName("escapes wildcards in a table name before looking up its columns")
		void escapesTableName() throws SQLException {
			when(connection.getMetaData()).thenReturn(metaData);
			when(metaData.getTables(isNull(), isNull(), eq("%"), any())).thenReturn(tables);
			when(tables.next()).thenReturn(true, false);
			when(tables.getString("TABLE_CAT")).thenReturn(null);
			when(tables.getString("TABLE_SCHEM")).thenReturn("public");
			when(tables.getString("TABLE_NAME")).thenReturn("user_x");
			when(metaData.getSearchStringEscape()).thenReturn("\\");
			when(metaData.getColumns(null, "public", "user\\_x", "%")).thenReturn(columns);
			when(columns.next()).thenReturn(true, false);
			when(columns.getString("COLUMN_NAME")).thenReturn("id");
			when(columns.getString("TYPE_NAME")).thenReturn("INTEGER");
			when(columns.getString("IS_NULLABLE")).thenReturn("NO");

			SchemaDescription schema = JdbcDatabaseConnector.builder(dataSource).build().showSchema();

			assertThat(schema.tableNames()).containsExactly("user_x");
			assertThat(schema.definition("user_x")).contains("CREATE TABLE user_x (\n  id INTEGER NOT NULL\n)");
		}

		@Test
		@DisplayName("qualifies a table name found in several schemas")
		void qualifiesRepeatedNames() throws SQLException {
			when(connection.getMetaData()).thenReturn(metaData);
			when(metaData.getTables(isNull(), isNull(), eq("%"), any())).thenReturn(tables);
			when(tables.next()).thenReturn(true, true, false);
			when(tables.getString("TABLE_CAT")).thenReturn(null, null);
			when(tables.getString("TABLE_SCHEM")).thenReturn("sales", "archive");
			when(tables.getString("TABLE_NAME")).thenReturn("users", "users");
			when(metaData.getColumns(null, "sales", "users", "%")).thenReturn(columns);
			when(metaData.getColumns(null, "archive", "users", "%")).thenReturn(otherColumns);
			when(columns.next()).thenReturn(true, false);
			when(columns.getString("COLUMN_NAME")).thenReturn("id");
			when(columns.getString("TYPE_NAME")).thenReturn("INTEGER");
			when(columns.getString("IS_NULLABLE")).thenReturn("NO");
			when(otherColumns.next()).thenReturn(true, false);
			when(otherColumns.getString("COLUMN_NAME")).thenReturn("legacy_id");
			when(otherColumns.getString("TYPE_NAME")).thenReturn("BIGINT");
			when(otherColumns.getString("IS_NULLABLE")).thenReturn("YES");

			SchemaDescription schema = JdbcDatabaseConnector.builder(dataSource).build().showSchema();

			assertThat(schema.tableNames()).containsExactlyInAnyOrder("sales.users", "archive.users");
			assertThat(schema.definition("sales.users")).contains("CREATE TABLE sales.users (\n  id INTEGER NOT NULL\n)");
			assertThat(schema.definition("archive.users")).contains("CREATE TABLE archive.users (\n  legacy_id BIGINT\n)");
		}

		@Test
		@DisplayName("maps metadata failures to DRIVER_ERROR")
		void metadataFailure() throws SQLException {
			when(connection.getMetaData()).thenThrow(new SQLException("connection refused"));

			expectFailure(ErrorKind.DRIVER_ERROR,
					() -> JdbcDatabaseConnector.builder(dataSource).build().showSchema());
		}
	}

	@Test
	@DisplayName("is read-only unless configured otherwise")
	void readOnlyByDefault() {
		assertThat(JdbcDatabaseConnector.builder(dataSource).build().allowWrites()).isFalse();
		assertThat(JdbcDatabaseConnector.builder(dataSource).allowWrites(true).build().allowWrites()).isTrue();
	}

	@Test
	@DisplayName("requires a data source")
	void requiresDataSource() {
		assertThatThrownBy(() -> JdbcDatabaseConnector.builder(null))
				.isInstanceOf(NullPointerException.class)
				.hasMessage("JdbcDatabaseConnector requires a data source");
	}

	@Test
	@DisplayName("normalizes binary values to Base64")
	void normalizesBinary() {
		assertThat(JdbcDatabaseConnector.normalize(new byte[] { 1, 2, 3 })).isEqualTo("AQID");
		assertThat(JdbcDatabaseConnector.normalize(null)).isNull();
	}

	@Test
	@DisplayName("numbers repeated labels in order of appearance")
	void uniqueLabels() {
		Set<String> taken = new HashSet<>();

		assertThat(List.of("id", "id", "name", "id").stream().map(label -> JdbcDatabaseConnector.uniqueLabel(label, taken)))
				.containsExactly("id", "id_2", "name", "id_3");
	}

	@Test
	@DisplayName("escapes LIKE wildcards and the escape itself")
	void escapesPatterns() {
		assertThat(JdbcDatabaseConnector.escapePattern("a_b%c\\d", "\\")).isEqualTo("a\\_b\\%c\\\\d");
		assertThat(JdbcDatabaseConnector.escapePattern("a_b", null)).isEqualTo("a_b");
		assertThat(JdbcDatabaseConnector.escapePattern("a_b", "")).isEqualTo("a_b");
	}
}
