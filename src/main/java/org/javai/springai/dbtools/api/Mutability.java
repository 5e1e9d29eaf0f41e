package org.javai.springai.dbtools.api;

/**
 * Describes whether a SQL statement may change the state of the database it
 * targets, so the execution gateway can decide whether the write gate applies.
 */
public enum Mutability {

	/**
	 * Statement only reads data. Read statements reach the connector without any
	 * authorization step.
	 */
	READ_ONLY,

	/**
	 * Statement may create, change or delete data or schema objects. Mutating
	 * statements are refused unless the connector allows writes, and are confirmed
	 * with the user when a confirmation channel is available.
	 */
	MUTATING
}
