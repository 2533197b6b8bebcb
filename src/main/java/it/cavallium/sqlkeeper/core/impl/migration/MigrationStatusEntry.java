package it.cavallium.sqlkeeper.core.impl.migration;

import org.jetbrains.annotations.Nullable;

/**
 * @param appliedAt null while the migration is pending
 */
public record MigrationStatusEntry(String version, String name, MigrationStatus status, @Nullable String appliedAt) {

	public static MigrationStatusEntry pending(String version, String name) {
		return new MigrationStatusEntry(version, name, MigrationStatus.PENDING, null);
	}

	public static MigrationStatusEntry applied(String version, String name, String appliedAt) {
		return new MigrationStatusEntry(version, name, MigrationStatus.APPLIED, appliedAt);
	}
}
