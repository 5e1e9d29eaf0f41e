package org.javai.springai.dbtools.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DatabaseToolsConfig")
class DatabaseToolsConfigTest {

	@Test
	@DisplayName("defaults disable activation and confirmation timeout")
	void defaults() {
		DatabaseToolsConfig config = DatabaseToolsConfig.defaults();

		assertThat(config.activation()).isFalse();
		assertThat(config.confirmationTimeout()).isEmpty();
		assertThat(config.providers()).isEmpty();
	}

	@Test
	@DisplayName("unconfigured providers get read-only enabled settings")
	void unconfiguredProvider() {
		assertThat(DatabaseToolsConfig.defaults().providerSettings("anything"))
				.isEqualTo(new ProviderSettings(false, true));
	}

	@Test
	@DisplayName("builder keeps provider settings in order")
	void builderKeepsProviders() {
		DatabaseToolsConfig config = DatabaseToolsConfig.builder()
				.activation(true)
				.confirmationTimeout(Duration.ofSeconds(30))
				.provider("scratch", ProviderSettings.writable().disabled())
				.provider("analytics", ProviderSettings.readOnly())
				.build();

		assertThat(config.activation()).isTrue();
		assertThat(config.confirmationTimeout()).contains(Duration.ofSeconds(30));
		assertThat(config.providers()).containsOnlyKeys("scratch", "analytics");
		assertThat(config.providers().keySet()).containsExactly("scratch", "analytics");
		assertThat(config.providerSettings("scratch")).isEqualTo(new ProviderSettings(true, false));
	}

	@Test
	@DisplayName("rejects a non-positive confirmation timeout")
	void rejectsNonPositiveTimeout() {
		assertThatThrownBy(() -> new DatabaseToolsConfig(false, Optional.of(Duration.ZERO), null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("rejects blank provider names")
	void rejectsBlankProviderName() {
		assertThatThrownBy(() -> DatabaseToolsConfig.builder().provider(" ", ProviderSettings.defaults()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
