package it.cavallium.sqlkeeper.core.config;

import org.github.gestalt.config.exceptions.GestaltException;

public interface DatabaseConnectionConfig {

	/**
	 * {@code sqlite:<path>} for an embedded database, {@code postgres://...} for a database server
	 */
	String url() throws GestaltException;

	boolean logRequests() throws GestaltException;
}
