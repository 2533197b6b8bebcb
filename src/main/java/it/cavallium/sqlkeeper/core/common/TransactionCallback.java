package it.cavallium.sqlkeeper.core.common;

@FunctionalInterface
public interface TransactionCallback<T> {

	T execute(SqlExecutor tx);
}
