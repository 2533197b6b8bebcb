package it.cavallium.sqlkeeper.core.common;

public class SqlKeeperException extends RuntimeException {

	private final SqlKeeperErrorType errorUniqueId;

	public enum SqlKeeperErrorType {
		CONFIG_ERROR,
		QUERY_FAILED,
		TRANSACTION_FAILED,
		CONNECTION_FAILED,
		MIGRATION_LOAD_ERROR,
		MIGRATION_FILE_ERROR,
		MIGRATION_NOT_FOUND,
		MIGRATION_CHECKSUM_MISMATCH,
		BACKUP_NOT_FOUND,
		BACKUP_FILE_MISSING,
		BACKUP_FAILED,
		EXTERNAL_TOOL_FAILED,
		EXTERNAL_TOOL_TIMEOUT,
		INVALID_CRON,
		INVALID_RETENTION,
		REPLICA_EXISTS,
		REPLICA_NOT_FOUND,
		REPLICA_FILE_MISSING,
		REPLICA_ADAPTER_FACTORY_MISSING,
		SYNC_FAILED,
		INVALID_ARGUMENT,
		FILE_OPERATION_FAILED
	}

	public static SqlKeeperException of(SqlKeeperErrorType errorUniqueId, String message) {
		return new SqlKeeperException(errorUniqueId, message);
	}

	public static SqlKeeperException of(SqlKeeperErrorType errorUniqueId, Throwable ex) {
		return new SqlKeeperException(errorUniqueId, ex);
	}

	public static SqlKeeperException of(SqlKeeperErrorType errorUniqueId, String message, Throwable ex) {
		return new SqlKeeperException(errorUniqueId, message, ex);
	}

	private SqlKeeperException(SqlKeeperErrorType errorUniqueId, String message) {
		super(message);
		this.errorUniqueId = errorUniqueId;
	}

	private SqlKeeperException(SqlKeeperErrorType errorUniqueId, String message, Throwable ex) {
		super(message + ": " + ex.getMessage(), ex);
		this.errorUniqueId = errorUniqueId;
	}

	private SqlKeeperException(SqlKeeperErrorType errorUniqueId, Throwable ex) {
		super(ex.toString(), ex);
		this.errorUniqueId = errorUniqueId;
	}

	public SqlKeeperErrorType getErrorUniqueId() {
		return errorUniqueId;
	}

	@Override
	public String getLocalizedMessage() {
		return "SqlKeeperError: [uid:" + errorUniqueId + "] " + getMessage();
	}
}
