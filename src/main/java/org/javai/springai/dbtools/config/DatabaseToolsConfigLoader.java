package org.javai.springai.dbtools.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link DatabaseToolsConfig} from the {@code database} section of a YAML document.
 *
 * <pre>{@code
 * database:
 *   activation: true
 *   confirmationTimeoutSeconds: 30
 *   providers:
 *     analytics: { allowWrites: false }
 *     scratch:   { allowWrites: true, enabled: false }
 * }</pre>
 *
 * <p>A document without a {@code database} section yields {@link Optional#empty()}: the
 * host has not asked for database tools at all.</p>
 */
public final class DatabaseToolsConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(DatabaseToolsConfigLoader.class);

	static final String SECTION = "database";

	private DatabaseToolsConfigLoader() {
	}

	public static Optional<DatabaseToolsConfig> load(Path path) {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return load(reader);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Cannot read database configuration " + path, e);
		}
	}

	public static Optional<DatabaseToolsConfig> load(InputStream in) {
		return fromDocument(parse(() -> new Yaml().load(in)));
	}

	public static Optional<DatabaseToolsConfig> load(Reader reader) {
		return fromDocument(parse(() -> new Yaml().load(reader)));
	}

	public static Optional<DatabaseToolsConfig> fromYaml(String yaml) {
		return load(new StringReader(yaml));
	}

	private static Object parse(Supplier<Object> parser) {
		try {
			return parser.get();
		}
		catch (YAMLException e) {
			throw new IllegalArgumentException("Malformed database configuration: " + e.getMessage(), e);
		}
	}

	private static Optional<DatabaseToolsConfig> fromDocument(Object document) {
		if (document == null) {
			return Optional.empty();
		}
		Map<?, ?> root = asMap(document, "<root>");
		if (!root.containsKey(SECTION)) {
			logger.debug("No '{}' section in configuration; database tools not configured", SECTION);
			return Optional.empty();
		}
		Map<?, ?> section = root.get(SECTION) != null ? asMap(root.get(SECTION), SECTION) : Map.of();

		DatabaseToolsConfig.Builder builder = DatabaseToolsConfig.builder()
				.activation(asBoolean(section.get("activation"), SECTION + ".activation", false));

		Object timeout = section.get("confirmationTimeoutSeconds");
		if (timeout != null) {
			if (!(timeout instanceof Number seconds) || seconds.longValue() <= 0) {
				throw new IllegalArgumentException(
						SECTION + ".confirmationTimeoutSeconds must be a positive number, got: " + timeout);
			}
			builder.confirmationTimeout(Duration.ofSeconds(seconds.longValue()));
		}

		Object providers = section.get("providers");
		if (providers != null) {
			asMap(providers, SECTION + ".providers").forEach((name, value) -> {
				String key = SECTION + ".providers." + name;
				Map<?, ?> settings = value != null ? asMap(value, key) : Map.of();
				builder.provider(String.valueOf(name), new ProviderSettings(
						asBoolean(settings.get("allowWrites"), key + ".allowWrites", false),
						asBoolean(settings.get("enabled"), key + ".enabled", true)));
			});
		}

		DatabaseToolsConfig config = builder.build();
		logger.debug("Loaded database configuration with {} provider(s), activation={}",
				config.providers().size(), config.activation());
		return Optional.of(config);
	}

	private static Map<?, ?> asMap(Object value, String key) {
		if (value instanceof Map<?, ?> map) {
			return map;
		}
		throw new IllegalArgumentException(key + " must be a mapping, got: " + value);
	}

	private static boolean asBoolean(Object value, String key, boolean defaultValue) {
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new IllegalArgumentException(key + " must be true or false, got: " + value);
	}
}
