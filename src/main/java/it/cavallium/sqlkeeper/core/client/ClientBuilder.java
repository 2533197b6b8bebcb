package it.cavallium.sqlkeeper.core.client;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import java.nio.file.Path;

public class ClientBuilder {

	private Path embeddedPath;
	private String connectionString;
	private boolean logRequests;

	public void setEmbeddedPath(Path path) {
		this.embeddedPath = path;
	}

	public void setConnectionString(String connectionString) {
		this.connectionString = connectionString;
	}

	public void setLogRequests(boolean logRequests) {
		this.logRequests = logRequests;
	}

	/**
	 * Configure the builder from a database url: {@code sqlite:<path>}, {@code file:<path>},
	 * {@code postgres://...} or {@code postgresql://...}
	 */
	public void setUrl(String url) {
		int colon = url.indexOf(':');
		if (colon <= 0) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Missing scheme in database url: " + url);
		}
		var scheme = url.substring(0, colon);
		var rest = url.substring(colon + 1);
		switch (scheme) {
			case "sqlite", "file" -> setEmbeddedPath(Path.of(rest.startsWith("//") ? rest.substring(2) : rest).normalize());
			case "postgres", "postgresql" -> setConnectionString(url);
			default -> throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT,
					"Invalid scheme \"" + scheme + "\" for database url: " + url);
		}
	}

	public DatabaseAdapter build() {
		DatabaseAdapter adapter;
		if (embeddedPath != null) {
			adapter = JdbcDatabaseAdapter.sqlite(embeddedPath);
		} else if (connectionString != null) {
			adapter = JdbcDatabaseAdapter.postgres(connectionString);
		} else {
			throw new UnsupportedOperationException("Please set a connection type");
		}
		return logRequests ? new LoggingDatabaseAdapter(adapter) : adapter;
	}
}
