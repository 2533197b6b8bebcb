package it.cavallium.sqlkeeper.core.impl.migration;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.ExecuteResult;
import it.cavallium.sqlkeeper.core.common.QueryResult;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.common.Utils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Helpers handed to seed functions. Calls are not wrapped in a transaction.
 */
public class SeedContext {

	private final DatabaseAdapter adapter;
	private final Logger logger;

	SeedContext(DatabaseAdapter adapter, Logger logger) {
		this.adapter = adapter;
		this.logger = logger;
	}

	/**
	 * Insert a row
	 * @return the inserted row as stored by the database
	 */
	public @Nullable Map<String, Object> insert(String table, Map<String, ?> data) {
		if (data.isEmpty()) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Can't insert an empty row into " + table);
		}
		var columns = new StringJoiner(", ");
		var placeholders = new StringJoiner(", ");
		var values = new ArrayList<Object>(data.size());
		int i = 1;
		for (Map.Entry<String, ?> entry : data.entrySet()) {
			columns.add(Utils.quoteIdentifier(entry.getKey()));
			placeholders.add("$" + i++);
			values.add(entry.getValue());
		}
		var insertSql = "INSERT INTO " + Utils.quoteIdentifier(table) + " (" + columns + ") VALUES (" + placeholders + ")";
		if (adapter.getInfo().isLocal()) {
			return adapter.transaction(tx -> {
				tx.execute(insertSql, values);
				return tx.queryOne("SELECT * FROM " + Utils.quoteIdentifier(table) + " WHERE rowid = last_insert_rowid()");
			});
		} else {
			return adapter.queryOne(insertSql + " RETURNING *", values);
		}
	}

	public void insertMany(String table, List<? extends Map<String, ?>> rows) {
		for (Map<String, ?> row : rows) {
			insert(table, row);
		}
	}

	/**
	 * Delete every row of a table
	 */
	public void truncate(String table) {
		adapter.execute("DELETE FROM " + Utils.quoteIdentifier(table));
	}

	public ExecuteResult execute(String sql, List<?> params) {
		return adapter.execute(sql, params);
	}

	public ExecuteResult execute(String sql) {
		return adapter.execute(sql);
	}

	public QueryResult query(String sql, List<?> params) {
		return adapter.query(sql, params);
	}

	public QueryResult query(String sql) {
		return adapter.query(sql);
	}

	public void log(String message) {
		logger.info("[seed] {}", message);
	}
}
