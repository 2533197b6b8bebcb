package it.cavallium.sqlkeeper.core.impl.migration;

import java.util.List;

/**
 * Differences that the pending migrations would introduce in the live schema.
 * Computed by scanning migration SQL, so it is an estimate and not a replacement for review.
 */
public record SchemaDiff(List<String> tablesAdded,
		List<String> tablesRemoved,
		List<ColumnChange> columnsAdded,
		List<ColumnRef> columnsRemoved,
		List<String> sql) {

	public record ColumnChange(String table, String column, String type) {}

	public record ColumnRef(String table, String column) {}

	public boolean isEmpty() {
		return tablesAdded.isEmpty() && tablesRemoved.isEmpty() && columnsAdded.isEmpty() && columnsRemoved.isEmpty();
	}

	/**
	 * @return true if applying the pending migrations would drop tables or columns
	 */
	public boolean isDestructive() {
		return !tablesRemoved.isEmpty() || !columnsRemoved.isEmpty();
	}
}
