package org.javai.springai.dbtools.config;

/**
 * Per-database settings.
 *
 * @param allowWrites whether mutating statements may run against the database
 * @param enabled whether the database is enabled when the registry uses activation
 */
public record ProviderSettings(boolean allowWrites, boolean enabled) {

	public static ProviderSettings defaults() {
		return new ProviderSettings(false, true);
	}

	public static ProviderSettings readOnly() {
		return defaults();
	}

	public static ProviderSettings writable() {
		return new ProviderSettings(true, true);
	}

	public ProviderSettings disabled() {
		return new ProviderSettings(allowWrites, false);
	}
}
