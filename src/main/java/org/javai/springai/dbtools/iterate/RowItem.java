package org.javai.springai.dbtools.iterate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a query result prepared for templating.
 *
 * @param value the row, column name to value
 * @param rowNumber 1-based position of the row in the result
 * @param totalRows number of rows in the result
 * @param json the row rendered as a JSON object
 */
public record RowItem(Map<String, Object> value, int rowNumber, int totalRows, String json) {

	/**
	 * Template variables for this row: {@code row}, {@code rowNumber}, {@code totalRows},
	 * {@code json}, followed by every column of the row under its own name. A column named
	 * like one of the fixed variables replaces it.
	 */
	public Map<String, Object> variables() {
		Map<String, Object> variables = new LinkedHashMap<>();
		variables.put("row", value);
		variables.put("rowNumber", rowNumber);
		variables.put("totalRows", totalRows);
		variables.put("json", json);
		variables.putAll(value);
		return variables;
	}
}
