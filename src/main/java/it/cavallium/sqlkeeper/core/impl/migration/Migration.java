package it.cavallium.sqlkeeper.core.impl.migration;

import it.cavallium.sqlkeeper.core.common.SqlExecutor;

/**
 * A schema change that can be applied and reverted. Both methods run inside the transaction
 * that also writes the bookkeeping row.
 */
public interface Migration {

	void up(SqlExecutor db);

	void down(SqlExecutor db);
}
