package it.cavallium.sqlkeeper.core.impl.backup;

import it.cavallium.sqlkeeper.core.common.Utils;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * @param checksum first 16 hex digits of the SHA-256 of the backup file
 */
public record BackupInfo(String id,
		String label,
		Path filepath,
		long sizeBytes,
		Instant createdAt,
		BackupType type,
		String checksum) {

	static BackupInfo fromRow(Map<String, Object> row) {
		return new BackupInfo(String.valueOf(row.get("id")),
				String.valueOf(row.get("label")),
				Path.of(String.valueOf(row.get("filepath"))),
				Utils.numberToLong(row.get("size_bytes")),
				Utils.parseTimestamp(row.get("created_at")),
				BackupType.fromId(String.valueOf(row.get("type"))),
				row.get("checksum") != null ? row.get("checksum").toString() : "");
	}

	public boolean isCompressed() {
		return filepath.getFileName().toString().endsWith(".gz");
	}
}
