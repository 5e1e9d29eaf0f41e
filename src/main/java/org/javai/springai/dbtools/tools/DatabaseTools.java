package org.javai.springai.dbtools.tools;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.springai.dbtools.api.ExecuteSqlResult;
import org.javai.springai.dbtools.exec.SqlExecutionGateway;
import org.javai.springai.dbtools.schema.SchemaInspector;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

/**
 * Database tools exposed to an LLM through Spring AI tool calling.
 *
 * <p>The model typically:</p>
 * <ol>
 *   <li>Calls {@link #listDatabases()} to learn which database names exist</li>
 *   <li>Calls {@link #showSchema(String)} for the database relevant to the user's request</li>
 *   <li>Calls {@link #executeSql(String, String)} with a statement written against that schema</li>
 * </ol>
 *
 * <p>Write statements go through the same gate as any other caller of the
 * {@link SqlExecutionGateway}: they are refused on read-only databases and, when the
 * host supplied a confirmation channel, confirmed with the user first. Failures are
 * thrown as {@link org.javai.springai.dbtools.api.DatabaseToolException}s and rendered
 * by Spring AI's tool exception processing.</p>
 *
 * <pre>{@code
 * ToolCallbackProvider provider = MethodToolCallbackProvider.builder()
 *     .toolObjects(new DatabaseTools(gateway, inspector))
 *     .build();
 * }</pre>
 */
public class DatabaseTools {

	public static final String EXECUTE_SQL = "database_executeSql";
	public static final String SHOW_SCHEMA = "database_showSchema";
	public static final String LIST_DATABASES = "database_listDatabases";

	private final SqlExecutionGateway gateway;
	private final SchemaInspector inspector;

	// Invocation tracking for testing
	private final AtomicInteger executeSqlCount = new AtomicInteger(0);
	private final AtomicInteger showSchemaCount = new AtomicInteger(0);
	private final AtomicInteger listDatabasesCount = new AtomicInteger(0);

	public DatabaseTools(SqlExecutionGateway gateway, SchemaInspector inspector) {
		this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
		this.inspector = Objects.requireNonNull(inspector, "inspector must not be null");
	}

	@Tool(name = EXECUTE_SQL, description = """
			Executes an SQL statement on one of the available databases.
			WARNING: statements other than SELECT can modify or delete data; they are refused on
			read-only databases and may require the user's approval.
			Returns: rows (column name to value) and fields (column names in order).""")
	public ExecuteSqlResult executeSql(
			@ToolParam(description = "Name of the database to run the statement on") String databaseName,
			@ToolParam(description = "The SQL statement to execute") String sqlQuery) {
		executeSqlCount.incrementAndGet();
		return gateway.executeQuery(databaseName, sqlQuery);
	}

	@Tool(name = SHOW_SCHEMA, description = """
			Shows the 'CREATE TABLE' statements (or equivalent) for all tables in the specified database.
			Call this before writing SQL against a database you have not inspected yet.""")
	public Map<String, String> showSchema(
			@ToolParam(description = "Name of the database whose schema to show") String databaseName) {
		showSchemaCount.incrementAndGet();
		return inspector.describeSchema(databaseName).tables();
	}

	@Tool(name = LIST_DATABASES, description = """
			Lists the names of all databases available to the database tools.""")
	public List<String> listDatabases() {
		listDatabasesCount.incrementAndGet();
		return gateway.registry().names();
	}

	// Test accessors

	public int executeSqlInvokedCount() {
		return executeSqlCount.get();
	}

	public int showSchemaInvokedCount() {
		return showSchemaCount.get();
	}

	public int listDatabasesInvokedCount() {
		return listDatabasesCount.get();
	}

	public void resetCounters() {
		executeSqlCount.set(0);
		showSchemaCount.set(0);
		listDatabasesCount.set(0);
	}
}
