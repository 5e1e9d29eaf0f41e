package org.javai.springai.dbtools.iterate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.javai.springai.dbtools.api.ExecuteSqlResult;
import org.javai.springai.dbtools.exec.ConnectorCalls;
import org.javai.springai.dbtools.exec.SqlExecutionGateway;
import org.javai.springai.dbtools.exec.StatementClassifier;

/**
 * Iterates over the rows of a read query, one {@link RowItem} per row, e.g. to run a
 * prompt template once per record.
 *
 * <p>Only read statements are accepted; a mutating statement fails with
 * {@code WRITE_NOT_PERMITTED} whatever the target database allows. The query runs
 * through the {@link SqlExecutionGateway} on the first call to {@link #iterator()}
 * and its result is reused by later iterations.</p>
 */
public final class SqlRowIterable implements Iterable<RowItem> {

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	private final SqlExecutionGateway gateway;
	private final String databaseName;
	private final String query;
	private List<RowItem> items;

	private SqlRowIterable(SqlExecutionGateway gateway, String databaseName, String query) {
		this.gateway = gateway;
		this.databaseName = databaseName;
		this.query = query;
	}

	public static SqlRowIterable of(SqlExecutionGateway gateway, String databaseName, String query) {
		Objects.requireNonNull(gateway, "gateway must not be null");
		ConnectorCalls.requireText(databaseName, "databaseName");
		ConnectorCalls.requireText(query, "query");
		if (!StatementClassifier.isRead(query)) {
			throw DatabaseToolException.writeNotPermitted(databaseName);
		}
		return new SqlRowIterable(gateway, databaseName, query);
	}

	@Override
	public synchronized Iterator<RowItem> iterator() {
		if (items == null) {
			items = load();
		}
		return items.iterator();
	}

	private List<RowItem> load() {
		ExecuteSqlResult result = gateway.executeQuery(databaseName, query);
		int total = result.rowCount();
		List<RowItem> loaded = new ArrayList<>(total);
		for (int i = 0; i < total; i++) {
			Map<String, Object> row = result.rows().get(i);
			loaded.add(new RowItem(row, i + 1, total, toJson(row)));
		}
		return List.copyOf(loaded);
	}

	private static String toJson(Map<String, Object> row) {
		try {
			return JSON_MAPPER.writeValueAsString(row);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Row could not be rendered as JSON", e);
		}
	}
}
