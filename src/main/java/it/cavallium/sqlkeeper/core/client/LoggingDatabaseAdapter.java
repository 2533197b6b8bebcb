package it.cavallium.sqlkeeper.core.client;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.DatabaseInfo;
import it.cavallium.sqlkeeper.core.common.ExecuteResult;
import it.cavallium.sqlkeeper.core.common.FileOperation;
import it.cavallium.sqlkeeper.core.common.QueryResult;
import it.cavallium.sqlkeeper.core.common.SqlExecutor;
import it.cavallium.sqlkeeper.core.common.TransactionCallback;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDatabaseAdapter implements DatabaseAdapter {

	private final DatabaseAdapter adapter;
	private final Logger logger;

	public LoggingDatabaseAdapter(DatabaseAdapter adapter) {
		this.adapter = adapter;
		this.logger = LoggerFactory.getLogger("db.requests");
	}

	public DatabaseAdapter getDelegate() {
		return adapter;
	}

	@Override
	public @NotNull QueryResult query(String sql, List<?> params) {
		return traced("query", sql, params, () -> adapter.query(sql, params));
	}

	@Override
	public @Nullable Map<String, Object> queryOne(String sql, List<?> params) {
		return traced("queryOne", sql, params, () -> adapter.queryOne(sql, params));
	}

	@Override
	public @NotNull ExecuteResult execute(String sql, List<?> params) {
		return traced("execute", sql, params, () -> adapter.execute(sql, params));
	}

	@Override
	public <T> T transaction(TransactionCallback<T> callback) {
		logger.trace("Transaction begin");
		T result;
		try {
			result = adapter.transaction(tx -> callback.execute(new LoggingExecutor(tx)));
		} catch (Throwable e) {
			logger.trace("Transaction rolled back    Error: {}", e.getMessage());
			throw e;
		}
		logger.trace("Transaction committed");
		return result;
	}

	@Override
	public DatabaseInfo getInfo() {
		return adapter.getInfo();
	}

	@Override
	public void offline(FileOperation operation) throws IOException {
		logger.trace("Releasing connection to {}", adapter.getInfo().database());
		adapter.offline(operation);
		logger.trace("Reopened connection to {}", adapter.getInfo().database());
	}

	@Override
	public void close() {
		adapter.close();
	}

	private <T> T traced(String kind, String sql, List<?> params, Supplier<T> request) {
		logger.trace("Request input ({}): {}    Params: {}", kind, sql, params);
		T result;
		try {
			result = request.get();
		} catch (Throwable e) {
			logger.trace("Request failed: {}    Error: {}", sql, e.getMessage());
			throw e;
		}
		logger.trace("Request executed: {}    Result: {}", sql, result);
		return result;
	}

	private class LoggingExecutor implements SqlExecutor {

		private final SqlExecutor tx;

		private LoggingExecutor(SqlExecutor tx) {
			this.tx = tx;
		}

		@Override
		public @NotNull QueryResult query(String sql, List<?> params) {
			return traced("tx query", sql, params, () -> tx.query(sql, params));
		}

		@Override
		public @Nullable Map<String, Object> queryOne(String sql, List<?> params) {
			return traced("tx queryOne", sql, params, () -> tx.queryOne(sql, params));
		}

		@Override
		public @NotNull ExecuteResult execute(String sql, List<?> params) {
			return traced("tx execute", sql, params, () -> tx.execute(sql, params));
		}
	}
}
