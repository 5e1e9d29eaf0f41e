package org.javai.springai.dbtools.api;

/**
 * Failure raised by the registry, the execution gateway or the schema inspector.
 *
 * <p>Every instance carries an {@link ErrorKind} and, where one applies, the name of
 * the database resource involved. Messages are written to be shown to an end user
 * as they are.</p>
 */
public class DatabaseToolException extends RuntimeException {

	private final ErrorKind kind;
	private final String resourceName;

	public DatabaseToolException(ErrorKind kind, String resourceName, String message) {
		super(message);
		this.kind = kind;
		this.resourceName = resourceName;
	}

	public DatabaseToolException(ErrorKind kind, String resourceName, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.resourceName = resourceName;
	}

	public ErrorKind kind() {
		return kind;
	}

	/**
	 * @return the database resource name, or {@code null} when the failure is not tied to one
	 */
	public String resourceName() {
		return resourceName;
	}

	/**
	 * Returns this exception if it already names a resource, otherwise a copy of the
	 * same kind that names {@code resourceName} in its message and has this exception
	 * as its cause.
	 */
	public DatabaseToolException withResource(String resourceName) {
		if (this.resourceName != null || resourceName == null) {
			return this;
		}
		return new DatabaseToolException(kind, resourceName,
				"Database '%s': %s".formatted(resourceName, getMessage()), this);
	}

	public static DatabaseToolException invalidArgument(String argumentName) {
		return new DatabaseToolException(ErrorKind.INVALID_ARGUMENT, null, argumentName + " is required");
	}

	public static DatabaseToolException notFound(String resourceName) {
		return new DatabaseToolException(ErrorKind.NOT_FOUND, resourceName,
				"Database '%s' not found".formatted(resourceName));
	}

	public static DatabaseToolException notEnabled(String resourceName) {
		return new DatabaseToolException(ErrorKind.NOT_ENABLED, resourceName,
				"Database '%s' is registered but not enabled".formatted(resourceName));
	}

	public static DatabaseToolException unknownResource(String resourceName) {
		return new DatabaseToolException(ErrorKind.UNKNOWN_RESOURCE, resourceName,
				"Cannot enable database '%s': no connector is registered under that name".formatted(resourceName));
	}

	public static DatabaseToolException writeNotPermitted(String resourceName) {
		return new DatabaseToolException(ErrorKind.WRITE_NOT_PERMITTED, resourceName,
				"Database '%s' does not allow write operations".formatted(resourceName));
	}

	public static DatabaseToolException userRejected(String resourceName) {
		return new DatabaseToolException(ErrorKind.USER_REJECTED, resourceName,
				"User did not approve the SQL write operation on database '%s'".formatted(resourceName));
	}

	public static DatabaseToolException userRejected(String resourceName, Throwable cause) {
		return new DatabaseToolException(ErrorKind.USER_REJECTED, resourceName,
				"No approval was received for the SQL write operation on database '%s'".formatted(resourceName),
				cause);
	}

	public static DatabaseToolException notImplemented(Class<?> connectorType, String operation) {
		return new DatabaseToolException(ErrorKind.NOT_IMPLEMENTED, null,
				"Method '%s()' must be implemented by %s".formatted(operation, connectorType.getName()));
	}
}
