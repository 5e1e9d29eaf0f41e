package org.javai.springai.dbtools.api;

/**
 * Connector-specific failure: connectivity, syntax, permissions at the database
 * layer and so on. The message comes from the driver and is opaque to the core.
 *
 * <p>Connectors do not know the name they are registered under, so they throw
 * without one; the gateway attaches the resource name with {@link #forResource(String)}
 * before the failure leaves the core.</p>
 */
public class DriverException extends DatabaseToolException {

	public DriverException(String message) {
		super(ErrorKind.DRIVER_ERROR, null, message);
	}

	public DriverException(String message, Throwable cause) {
		super(ErrorKind.DRIVER_ERROR, null, message, cause);
	}

	public DriverException(String resourceName, String message, Throwable cause) {
		super(ErrorKind.DRIVER_ERROR, resourceName, message, cause);
	}

	/**
	 * Returns this exception if it already names a resource, otherwise a copy that
	 * names {@code resourceName}, keeps the driver's message and has this exception
	 * as its cause.
	 */
	public DriverException forResource(String resourceName) {
		if (resourceName() != null || resourceName == null) {
			return this;
		}
		return new DriverException(resourceName, getMessage(), this);
	}

	/**
	 * Same as {@link #forResource(String)}: the driver's message is kept as it is.
	 */
	@Override
	public DriverException withResource(String resourceName) {
		return forResource(resourceName);
	}
}
