package it.cavallium.sqlkeeper.core.impl.migration;

public enum MigrationStatus {
	PENDING,
	APPLIED
}
