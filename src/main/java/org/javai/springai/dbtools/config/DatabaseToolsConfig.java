package org.javai.springai.dbtools.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for the database tools.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults: no activation, no confirmation timeout, no provider settings
 * DatabaseToolsConfig config = DatabaseToolsConfig.defaults();
 *
 * // Custom configuration
 * DatabaseToolsConfig config = DatabaseToolsConfig.builder()
 *         .activation(true)
 *         .confirmationTimeout(Duration.ofSeconds(30))
 *         .provider("analytics", ProviderSettings.readOnly())
 *         .provider("scratch", ProviderSettings.writable().disabled())
 *         .build();
 * }</pre>
 *
 * @param activation whether databases must be enabled before they can be used
 * @param confirmationTimeout how long to wait for a write confirmation; empty waits indefinitely
 * @param providers settings per database name
 */
public record DatabaseToolsConfig(
		boolean activation,
		Optional<Duration> confirmationTimeout,
		Map<String, ProviderSettings> providers
) {

	public DatabaseToolsConfig {
		confirmationTimeout = confirmationTimeout != null ? confirmationTimeout : Optional.empty();
		confirmationTimeout.ifPresent(timeout -> {
			if (timeout.isNegative() || timeout.isZero()) {
				throw new IllegalArgumentException("confirmationTimeout must be positive");
			}
		});
		providers = providers != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(providers))
				: Map.of();
	}

	/**
	 * Creates a configuration with default values.
	 *
	 * @return default configuration
	 */
	public static DatabaseToolsConfig defaults() {
		return new DatabaseToolsConfig(false, Optional.empty(), Map.of());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Settings for {@code name}, or {@link ProviderSettings#defaults()} when none are configured.
	 */
	public ProviderSettings providerSettings(String name) {
		return providers.getOrDefault(name, ProviderSettings.defaults());
	}

	/**
	 * Builder for {@link DatabaseToolsConfig}.
	 */
	public static class Builder {
		private boolean activation = false;
		private Duration confirmationTimeout;
		private final Map<String, ProviderSettings> providers = new LinkedHashMap<>();

		private Builder() {}

		/**
		 * Requires databases to be enabled before use. Only providers whose settings are
		 * {@link ProviderSettings#enabled() enabled} are activated.
		 */
		public Builder activation(boolean activation) {
			this.activation = activation;
			return this;
		}

		/**
		 * Treats a confirmation that has not arrived within {@code timeout} as a rejection.
		 */
		public Builder confirmationTimeout(Duration timeout) {
			this.confirmationTimeout = timeout;
			return this;
		}

		public Builder provider(String name, ProviderSettings settings) {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("provider name must not be blank");
			}
			providers.put(name, Objects.requireNonNull(settings, "settings must not be null"));
			return this;
		}

		public DatabaseToolsConfig build() {
			return new DatabaseToolsConfig(activation, Optional.ofNullable(confirmationTimeout), providers);
		}
	}
}
