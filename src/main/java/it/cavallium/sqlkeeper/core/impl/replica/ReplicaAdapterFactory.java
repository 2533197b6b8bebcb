package it.cavallium.sqlkeeper.core.impl.replica;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;

@FunctionalInterface
public interface ReplicaAdapterFactory {

	/**
	 * @param connectionString file path in embedded mode, server connection string otherwise
	 */
	DatabaseAdapter open(String connectionString);
}
