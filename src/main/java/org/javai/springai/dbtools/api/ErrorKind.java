package org.javai.springai.dbtools.api;

/**
 * Machine-readable classification of database tool failures.
 *
 * <p>Callers switch on the kind rather than matching message text, e.g. to tell
 * "no such database" apart from "database exists but is disabled".</p>
 */
public enum ErrorKind {

	/** A required input was missing or blank. */
	INVALID_ARGUMENT,

	/** No connector is registered under the requested name. */
	NOT_FOUND,

	/** A connector is registered under the name but has not been enabled. */
	NOT_ENABLED,

	/** Activation was requested for a name that was never registered. */
	UNKNOWN_RESOURCE,

	/** A mutating statement targeted a connector that does not allow writes. */
	WRITE_NOT_PERMITTED,

	/** The user declined (or did not answer) a write confirmation. */
	USER_REJECTED,

	/** The connector does not implement the requested operation. */
	NOT_IMPLEMENTED,

	/** The connector failed while talking to its database. */
	DRIVER_ERROR
}
