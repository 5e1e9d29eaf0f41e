package org.javai.springai.dbtools.exec;

import java.util.function.Supplier;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.javai.springai.dbtools.api.DriverException;

/**
 * Shared argument checks and failure mapping for calls into a connector.
 */
public final class ConnectorCalls {

	private ConnectorCalls() {
	}

	/**
	 * @throws DatabaseToolException of kind {@code INVALID_ARGUMENT} when {@code value} is null or blank
	 */
	public static String requireText(String value, String argumentName) {
		if (value == null || value.isBlank()) {
			throw DatabaseToolException.invalidArgument(argumentName);
		}
		return value;
	}

	/**
	 * Runs {@code call} against the connector registered as {@code resourceName}.
	 *
	 * <p>{@link DatabaseToolException}s that do not name a resource gain
	 * {@code resourceName} ({@link DriverException}s keep the driver's message); any other
	 * runtime failure, and a {@code null} result, become a {@link DriverException}.</p>
	 */
	public static <T> T invoke(String resourceName, String operation, Supplier<T> call) {
		T result;
		try {
			result = call.get();
		}
		catch (DatabaseToolException e) {
			throw e.withResource(resourceName);
		}
		catch (RuntimeException e) {
			String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
			throw new DriverException(resourceName, detail, e);
		}
		if (result == null) {
			throw new DriverException(resourceName,
					"Connector for database '%s' returned no result from %s()".formatted(resourceName, operation),
					null);
		}
		return result;
	}
}
