package it.cavallium.sqlkeeper.core.impl.migration;

import java.util.Map;

/**
 * Row of the applied migrations table
 */
public record MigrationRecord(String version, String name, String appliedAt, String checksum) {

	static MigrationRecord fromRow(Map<String, Object> row) {
		var checksum = row.get("checksum");
		return new MigrationRecord(String.valueOf(row.get("version")),
				String.valueOf(row.get("name")),
				String.valueOf(row.get("applied_at")),
				checksum != null ? checksum.toString() : "");
	}
}
