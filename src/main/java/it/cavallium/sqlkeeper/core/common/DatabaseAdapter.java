package it.cavallium.sqlkeeper.core.common;

import java.io.Closeable;
import java.io.IOException;

public interface DatabaseAdapter extends SqlExecutor, Closeable {

	/**
	 * Run {@code callback} inside a transaction. The transaction commits when the callback returns and rolls back
	 * when it throws; the exception is rethrown unchanged.
	 */
	<T> T transaction(TransactionCallback<T> callback);

	DatabaseInfo getInfo();

	/**
	 * Run a file-system operation on the database files while the adapter has released its underlying handle.
	 * The handle is reopened afterward, also when the operation fails.
	 */
	default void offline(FileOperation operation) throws IOException {
		operation.run();
	}

	@Override
	void close();
}
