package org.javai.springai.dbtools.api;

/**
 * Convenience base class holding the immutable write permission.
 */
public abstract class AbstractDatabaseConnector implements DatabaseConnector {

	private final boolean allowWrites;

	protected AbstractDatabaseConnector(boolean allowWrites) {
		this.allowWrites = allowWrites;
	}

	@Override
	public final boolean allowWrites() {
		return allowWrites;
	}
}
