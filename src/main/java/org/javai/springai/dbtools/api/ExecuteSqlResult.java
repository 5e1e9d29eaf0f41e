package org.javai.springai.dbtools.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rows and column names returned by {@link DatabaseConnector#executeSql(String)}.
 *
 * <p>Each row maps a column name to a {@code String}, a {@code Number} or
 * {@code null}. Every key used in a row appears in {@link #fields()}, whose order
 * is the column order of the result.</p>
 *
 * <pre>{@code
 * ExecuteSqlResult result = ExecuteSqlResult.builder("id", "name")
 *     .row(1, "alice")
 *     .row(2, null)
 *     .build();
 * }</pre>
 *
 * @param rows result rows in order (never null)
 * @param fields column names in order (never null)
 */
public record ExecuteSqlResult(List<Map<String, Object>> rows, List<String> fields) {

	public ExecuteSqlResult {
		fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
		Objects.requireNonNull(rows, "rows must not be null");
		Set<String> known = new HashSet<>(fields);
		List<Map<String, Object>> copies = new ArrayList<>(rows.size());
		for (Map<String, Object> row : rows) {
			Objects.requireNonNull(row, "rows must not contain null");
			for (Map.Entry<String, Object> cell : row.entrySet()) {
				if (!known.contains(cell.getKey())) {
					throw new IllegalArgumentException(
							"Row column '%s' is not one of the result fields %s".formatted(cell.getKey(), fields));
				}
				Object value = cell.getValue();
				if (value != null && !(value instanceof String) && !(value instanceof Number)) {
					throw new IllegalArgumentException(
							"Column '%s' holds a %s; values must be strings, numbers or null"
									.formatted(cell.getKey(), value.getClass().getName()));
				}
			}
			// Map.copyOf rejects null values, which are legal cells
			copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
		}
		rows = Collections.unmodifiableList(copies);
	}

	public static ExecuteSqlResult empty() {
		return new ExecuteSqlResult(List.of(), List.of());
	}

	/**
	 * Result of a statement that produced no result set.
	 */
	public static ExecuteSqlResult updateCount(int count) {
		Map<String, Object> row = new LinkedHashMap<>();
		row.put("updateCount", count);
		return new ExecuteSqlResult(List.of(row), List.of("updateCount"));
	}

	public static Builder builder(String... fields) {
		return new Builder(Arrays.asList(fields));
	}

	public int rowCount() {
		return rows.size();
	}

	/**
	 * Positional row builder. Values are matched to fields by index.
	 */
	public static final class Builder {
		private final List<String> fields;
		private final List<Map<String, Object>> rows = new ArrayList<>();

		private Builder(List<String> fields) {
			this.fields = List.copyOf(fields);
		}

		public Builder row(Object... values) {
			if (values.length != fields.size()) {
				throw new IllegalArgumentException(
						"Expected %d values but got %d".formatted(fields.size(), values.length));
			}
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 0; i < values.length; i++) {
				row.put(fields.get(i), values[i]);
			}
			rows.add(row);
			return this;
		}

		public ExecuteSqlResult build() {
			return new ExecuteSqlResult(rows, fields);
		}
	}
}
