package it.cavallium.sqlkeeper.core.impl;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.Utils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads table and column names from the database catalog, for both embedded and server databases.
 */
public final class SchemaCatalog {

	/**
	 * Tables whose name starts with this prefix hold bookkeeping data and are hidden from schema diffs
	 */
	public static final String INTERNAL_TABLE_PREFIX = "_sqlkeeper_";

	public static final String DEFAULT_PRIMARY_KEY = "id";

	private SchemaCatalog() {
	}

	/**
	 * @return user tables, excluding engine and bookkeeping tables
	 */
	public static List<String> listTables(DatabaseAdapter adapter) {
		String sql;
		if (adapter.getInfo().isLocal()) {
			sql = "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\'"
					+ " AND name NOT LIKE '\\_sqlkeeper\\_%' ESCAPE '\\' ORDER BY name";
		} else {
			sql = "SELECT tablename AS name FROM pg_tables WHERE schemaname = 'public'"
					+ " AND tablename NOT LIKE '\\_sqlkeeper\\_%' ESCAPE '\\' ORDER BY tablename";
		}
		var tables = new ArrayList<String>();
		for (Map<String, Object> row : adapter.query(sql).rows()) {
			tables.add(String.valueOf(row.get("name")));
		}
		return tables;
	}

	public static List<String> listColumns(DatabaseAdapter adapter, String table) {
		var columns = new ArrayList<String>();
		if (adapter.getInfo().isLocal()) {
			for (Map<String, Object> row : adapter.query("PRAGMA table_info(" + Utils.quoteIdentifier(table) + ")").rows()) {
				columns.add(String.valueOf(row.get("name")));
			}
		} else {
			var rows = adapter.query("SELECT column_name FROM information_schema.columns"
					+ " WHERE table_schema = 'public' AND table_name = $1 ORDER BY ordinal_position", List.of(table)).rows();
			for (Map<String, Object> row : rows) {
				columns.add(String.valueOf(row.get("column_name")));
			}
		}
		return columns;
	}

	/**
	 * @return the first primary key column of {@code table}, or {@value #DEFAULT_PRIMARY_KEY} if it has none
	 */
	public static String detectPrimaryKey(DatabaseAdapter adapter, String table) {
		if (adapter.getInfo().isLocal()) {
			for (Map<String, Object> row : adapter.query("PRAGMA table_info(" + Utils.quoteIdentifier(table) + ")").rows()) {
				if (Utils.numberToLong(row.get("pk")) == 1) {
					return String.valueOf(row.get("name"));
				}
			}
			return DEFAULT_PRIMARY_KEY;
		} else {
			var row = adapter.queryOne("SELECT kcu.column_name FROM information_schema.table_constraints tc"
					+ " JOIN information_schema.key_column_usage kcu"
					+ " ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema"
					+ " WHERE tc.constraint_type = 'PRIMARY KEY' AND tc.table_schema = 'public' AND tc.table_name = $1"
					+ " ORDER BY kcu.ordinal_position LIMIT 1", List.of(table));
			return row != null ? String.valueOf(row.get("column_name")) : DEFAULT_PRIMARY_KEY;
		}
	}
}
