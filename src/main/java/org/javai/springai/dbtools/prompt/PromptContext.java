package org.javai.springai.dbtools.prompt;

import java.util.Map;
import java.util.Optional;

/**
 * Context passed to prompt contributors when the host assembles a system prompt.
 */
public record PromptContext(Map<String, Object> values) {

	public PromptContext {
		values = values != null ? Map.copyOf(values) : Map.of();
	}

	public static PromptContext empty() {
		return new PromptContext(Map.of());
	}

	public Optional<Object> contextFor(String key) {
		return Optional.ofNullable(values.get(key));
	}
}
