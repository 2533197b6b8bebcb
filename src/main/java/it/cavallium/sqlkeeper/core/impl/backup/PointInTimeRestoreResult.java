package it.cavallium.sqlkeeper.core.impl.backup;

import java.time.Duration;
import java.time.Instant;

/**
 * @param possibleDataLossWindow changes committed in this window after the backup are not restored
 */
public record PointInTimeRestoreResult(BackupInfo backup, Instant target, Duration possibleDataLossWindow) {}
