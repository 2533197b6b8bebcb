package it.cavallium.sqlkeeper.core.impl.backup;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public record RetentionPolicy(int maxBackups, int retentionDays) {

	/**
	 * Pick the backups to delete. Backups are scanned oldest first; each one goes if it is older than
	 * {@code retentionDays} or if more than {@code maxBackups} backups would otherwise remain.
	 */
	public List<BackupInfo> selectExpired(List<BackupInfo> backups, Instant now) {
		var sorted = new ArrayList<>(backups);
		sorted.sort(Comparator.comparing(BackupInfo::createdAt).thenComparing(BackupInfo::id));
		var maxAge = Duration.ofDays(retentionDays);
		var expired = new ArrayList<BackupInfo>();
		int remaining = sorted.size();
		for (BackupInfo backup : sorted) {
			boolean tooOld = Duration.between(backup.createdAt(), now).compareTo(maxAge) > 0;
			boolean tooMany = remaining > maxBackups;
			if (tooOld || tooMany) {
				expired.add(backup);
				remaining--;
			}
		}
		return expired;
	}
}
