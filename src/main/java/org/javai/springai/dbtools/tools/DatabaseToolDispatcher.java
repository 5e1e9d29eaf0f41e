package org.javai.springai.dbtools.tools;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.javai.springai.dbtools.api.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invokes the database tools by name with a loosely typed argument map, for hosts
 * that route tool calls themselves instead of through Spring AI.
 *
 * <p>Both the slash form used by agent runtimes ({@code database/executeSql}) and the
 * Spring AI form ({@code database_executeSql}) are accepted. Arguments are bound with
 * Jackson; unknown arguments are ignored.</p>
 */
public final class DatabaseToolDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(DatabaseToolDispatcher.class);

	private final DatabaseTools tools;
	private final ObjectMapper objectMapper;

	public DatabaseToolDispatcher(DatabaseTools tools) {
		this.tools = Objects.requireNonNull(tools, "tools must not be null");
		this.objectMapper = new ObjectMapper()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	public List<String> toolNames() {
		return List.of(DatabaseTools.EXECUTE_SQL, DatabaseTools.SHOW_SCHEMA, DatabaseTools.LIST_DATABASES);
	}

	public ToolOutcome invoke(String toolName, Map<String, Object> arguments) {
		Map<String, Object> args = arguments != null ? arguments : Map.of();
		String normalized = toolName != null ? toolName.replace('/', '_') : "";
		logger.info("Invoking tool {} with arguments {}", toolName, args.keySet());
		try {
			return switch (normalized) {
				case DatabaseTools.EXECUTE_SQL -> {
					ExecuteSqlArguments bound = bind(args, ExecuteSqlArguments.class);
					yield new ToolOutcome.Success(tools.executeSql(bound.databaseName(), bound.sqlQuery()));
				}
				case DatabaseTools.SHOW_SCHEMA -> {
					ShowSchemaArguments bound = bind(args, ShowSchemaArguments.class);
					yield new ToolOutcome.Success(tools.showSchema(bound.databaseName()));
				}
				case DatabaseTools.LIST_DATABASES -> new ToolOutcome.Success(tools.listDatabases());
				default -> new ToolOutcome.Failure(ErrorKind.INVALID_ARGUMENT, null, "Unknown tool: " + toolName);
			};
		}
		catch (DatabaseToolException e) {
			logger.warn("Tool {} failed with {}: {}", toolName, e.kind(), e.getMessage());
			return ToolOutcome.Failure.from(e);
		}
	}

	private <T> T bind(Map<String, Object> arguments, Class<T> type) {
		try {
			return objectMapper.convertValue(arguments, type);
		}
		catch (IllegalArgumentException e) {
			throw new DatabaseToolException(ErrorKind.INVALID_ARGUMENT, null,
					"Invalid tool arguments: " + e.getMessage(), e);
		}
	}

	record ExecuteSqlArguments(String databaseName, String sqlQuery) {
	}

	record ShowSchemaArguments(String databaseName) {
	}
}
