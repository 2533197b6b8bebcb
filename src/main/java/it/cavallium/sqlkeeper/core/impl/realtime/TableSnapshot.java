package it.cavallium.sqlkeeper.core.impl.realtime;

import it.cavallium.sqlkeeper.core.common.cdc.CdcChange;
import it.cavallium.sqlkeeper.core.common.cdc.CdcEventType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Last observed rows of a table, keyed by the stringified primary key
 */
final class TableSnapshot {

	private final String table;
	private final String primaryKey;
	private Map<String, Map<String, Object>> rows;

	private TableSnapshot(String table, String primaryKey, Map<String, Map<String, Object>> rows) {
		this.table = table;
		this.primaryKey = primaryKey;
		this.rows = rows;
	}

	static TableSnapshot of(String table, String primaryKey, List<Map<String, Object>> rows) {
		return new TableSnapshot(table, primaryKey, index(primaryKey, rows));
	}

	String primaryKey() {
		return primaryKey;
	}

	int size() {
		return rows.size();
	}

	private static Map<String, Map<String, Object>> index(String primaryKey, List<Map<String, Object>> rows) {
		var indexed = new LinkedHashMap<String, Map<String, Object>>(rows.size() * 2);
		for (Map<String, Object> row : rows) {
			var key = row.get(primaryKey);
			indexed.put(key == null ? "" : stringify(key), row);
		}
		return indexed;
	}

	/**
	 * Compare the current rows with the snapshot, then make them the new snapshot
	 * @return inserts and updates in current row order, then deletes in snapshot order
	 */
	List<CdcChange> advance(List<Map<String, Object>> currentRows, Instant now) {
		var current = index(primaryKey, currentRows);
		var changes = new ArrayList<CdcChange>();
		for (Map.Entry<String, Map<String, Object>> entry : current.entrySet()) {
			var oldRow = rows.get(entry.getKey());
			var newRow = entry.getValue();
			if (oldRow == null) {
				changes.add(new CdcChange(CdcEventType.INSERT, table, null, newRow, now, CdcChange.DEFAULT_SCHEMA));
			} else if (isChanged(oldRow, newRow)) {
				changes.add(new CdcChange(CdcEventType.UPDATE, table, oldRow, newRow, now, CdcChange.DEFAULT_SCHEMA));
			}
		}
		for (Map.Entry<String, Map<String, Object>> entry : rows.entrySet()) {
			if (!current.containsKey(entry.getKey())) {
				changes.add(new CdcChange(CdcEventType.DELETE, table, entry.getValue(), null, now, CdcChange.DEFAULT_SCHEMA));
			}
		}
		rows = current;
		return changes;
	}

	private static boolean isChanged(Map<String, Object> oldRow, Map<String, Object> newRow) {
		for (Map.Entry<String, Object> column : newRow.entrySet()) {
			if (!Objects.equals(stringify(column.getValue()), stringify(oldRow.get(column.getKey())))) {
				return true;
			}
		}
		return false;
	}

	private static String stringify(@Nullable Object value) {
		if (value instanceof byte[] bytes) {
			return HexFormat.of().formatHex(bytes);
		}
		return String.valueOf(value);
	}
}
