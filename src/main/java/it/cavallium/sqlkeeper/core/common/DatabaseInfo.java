package it.cavallium.sqlkeeper.core.common;

/**
 * @param mode     {@link #MODE_LOCAL} for an embedded database file, {@link #MODE_REMOTE} for a database server
 * @param database file path of the embedded database, or the connection string of the server
 */
public record DatabaseInfo(String mode, String database) {

	public static final String MODE_LOCAL = "local";
	public static final String MODE_REMOTE = "remote";

	public static DatabaseInfo local(String path) {
		return new DatabaseInfo(MODE_LOCAL, path);
	}

	public static DatabaseInfo remote(String connectionString) {
		return new DatabaseInfo(MODE_REMOTE, connectionString);
	}

	public boolean isLocal() {
		return MODE_LOCAL.equals(mode);
	}
}
