package it.cavallium.sqlkeeper.core.common;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Runs SQL statements. Placeholders are written {@code $1, $2, ...} and bound from {@code params} in order,
 * so {@code params} may contain nulls.
 */
public interface SqlExecutor {

	@NotNull
	QueryResult query(String sql, List<?> params);

	default @NotNull QueryResult query(String sql) {
		return query(sql, List.of());
	}

	/**
	 * @return the first row, or null if the query returned no rows
	 */
	@Nullable
	Map<String, Object> queryOne(String sql, List<?> params);

	default @Nullable Map<String, Object> queryOne(String sql) {
		return queryOne(sql, List.of());
	}

	@NotNull
	ExecuteResult execute(String sql, List<?> params);

	default @NotNull ExecuteResult execute(String sql) {
		return execute(sql, List.of());
	}
}
