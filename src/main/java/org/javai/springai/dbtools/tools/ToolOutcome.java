package org.javai.springai.dbtools.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.javai.springai.dbtools.api.ErrorKind;

/**
 * Result of a tool invoked through {@link DatabaseToolDispatcher}: either the tool's
 * value or a typed failure. Failures are values here, never thrown.
 */
public sealed interface ToolOutcome {

	/**
	 * Renders the outcome as JSON for hosts that pass tool results on as text.
	 */
	String toJson(ObjectMapper mapper);

	record Success(Object value) implements ToolOutcome {

		@Override
		public String toJson(ObjectMapper mapper) {
			try {
				return mapper.writeValueAsString(value);
			}
			catch (JsonProcessingException e) {
				throw new IllegalStateException("Tool result could not be rendered as JSON", e);
			}
		}
	}

	record Failure(ErrorKind kind, String resourceName, String message) implements ToolOutcome {

		public static Failure from(DatabaseToolException e) {
			return new Failure(e.kind(), e.resourceName(), e.getMessage());
		}

		@Override
		public String toJson(ObjectMapper mapper) {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("error", message);
			body.put("kind", kind.name());
			if (resourceName != null) {
				body.put("databaseName", resourceName);
			}
			try {
				return mapper.writeValueAsString(body);
			}
			catch (JsonProcessingException e) {
				throw new IllegalStateException("Tool failure could not be rendered as JSON", e);
			}
		}
	}
}
