package it.cavallium.sqlkeeper.core.impl.backup;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;

public enum BackupType {
	MANUAL("manual"),
	SCHEDULED("scheduled"),
	PRE_RESTORE("pre-restore");

	private final String id;

	BackupType(String id) {
		this.id = id;
	}

	/**
	 * @return the value stored in the metadata table
	 */
	public String id() {
		return id;
	}

	public static BackupType fromId(String id) {
		for (BackupType type : values()) {
			if (type.id.equals(id)) {
				return type;
			}
		}
		throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Unknown backup type: " + id);
	}
}
