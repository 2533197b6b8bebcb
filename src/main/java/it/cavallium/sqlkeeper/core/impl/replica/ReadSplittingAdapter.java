package it.cavallium.sqlkeeper.core.impl.replica;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.DatabaseInfo;
import it.cavallium.sqlkeeper.core.common.ExecuteResult;
import it.cavallium.sqlkeeper.core.common.FileOperation;
import it.cavallium.sqlkeeper.core.common.QueryResult;
import it.cavallium.sqlkeeper.core.common.TransactionCallback;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Sends reads to the next active replica and everything else to the primary.
 * A failing replica is marked {@link ReplicaStatus#ERROR} and the read is retried on the primary.
 */
class ReadSplittingAdapter implements DatabaseAdapter {

	private static final String[] READ_PREFIXES = {"SELECT", "EXPLAIN", "PRAGMA", "WITH"};

	private final DatabaseAdapter primary;
	private final Supplier<ReplicaEntry> nextReplica;
	private final Logger logger;

	ReadSplittingAdapter(DatabaseAdapter primary, Supplier<ReplicaEntry> nextReplica, Logger logger) {
		this.primary = primary;
		this.nextReplica = nextReplica;
		this.logger = logger;
	}

	static boolean isReadQuery(String sql) {
		var trimmed = sql.trim().toUpperCase(Locale.ROOT);
		for (String prefix : READ_PREFIXES) {
			if (trimmed.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public @NotNull QueryResult query(String sql, List<?> params) {
		if (isReadQuery(sql)) {
			var replica = nextReplica.get();
			if (replica != null) {
				try {
					var result = replica.adapter.query(sql, params);
					replica.queriesServed.incrementAndGet();
					return result;
				} catch (RuntimeException e) {
					markFailed(replica, e);
				}
			}
		}
		return primary.query(sql, params);
	}

	@Override
	public @Nullable Map<String, Object> queryOne(String sql, List<?> params) {
		if (isReadQuery(sql)) {
			var replica = nextReplica.get();
			if (replica != null) {
				try {
					var result = replica.adapter.queryOne(sql, params);
					replica.queriesServed.incrementAndGet();
					return result;
				} catch (RuntimeException e) {
					markFailed(replica, e);
				}
			}
		}
		return primary.queryOne(sql, params);
	}

	private void markFailed(ReplicaEntry replica, RuntimeException e) {
		replica.status = ReplicaStatus.ERROR;
		logger.warn("Replica \"{}\" failed, reading from primary: {}", replica.name, e.getMessage());
	}

	@Override
	public @NotNull ExecuteResult execute(String sql, List<?> params) {
		return primary.execute(sql, params);
	}

	@Override
	public <T> T transaction(TransactionCallback<T> callback) {
		return primary.transaction(callback);
	}

	@Override
	public DatabaseInfo getInfo() {
		return primary.getInfo();
	}

	@Override
	public void offline(FileOperation operation) throws IOException {
		primary.offline(operation);
	}

	/**
	 * Close the primary. Replicas are closed by their manager.
	 */
	@Override
	public void close() {
		primary.close();
	}
}
