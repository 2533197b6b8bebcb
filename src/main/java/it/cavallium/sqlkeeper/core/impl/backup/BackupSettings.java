package it.cavallium.sqlkeeper.core.impl.backup;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.config.BackupsConfig;
import java.nio.file.Path;
import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

/**
 * @param toolTimeout maximum run time of {@code pg_dump} and {@code psql}
 */
public record BackupSettings(Path directory,
		int maxBackups,
		int retentionDays,
		boolean compression,
		Duration toolTimeout,
		String pgDumpCommand,
		String psqlCommand) {

	public static final Path DEFAULT_DIRECTORY = Path.of("./backups");
	public static final int DEFAULT_MAX_BACKUPS = 50;
	public static final int DEFAULT_RETENTION_DAYS = 30;
	public static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(120);

	public static BackupSettings defaults() {
		return of(DEFAULT_DIRECTORY);
	}

	public static BackupSettings of(Path directory) {
		return new BackupSettings(directory,
				DEFAULT_MAX_BACKUPS,
				DEFAULT_RETENTION_DAYS,
				false,
				DEFAULT_TOOL_TIMEOUT,
				"pg_dump",
				"psql");
	}

	public static BackupSettings of(BackupsConfig config) {
		try {
			return new BackupSettings(config.directory(),
					config.maxBackups(),
					config.retentionDays(),
					config.compression(),
					config.externalToolTimeout(),
					config.pgDumpCommand(),
					config.psqlCommand());
		} catch (GestaltException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.CONFIG_ERROR, "Invalid backups config", e);
		}
	}

	public BackupSettings withMaxBackups(int maxBackups) {
		return new BackupSettings(directory, maxBackups, retentionDays, compression, toolTimeout, pgDumpCommand, psqlCommand);
	}

	public BackupSettings withRetentionDays(int retentionDays) {
		return new BackupSettings(directory, maxBackups, retentionDays, compression, toolTimeout, pgDumpCommand, psqlCommand);
	}

	public BackupSettings withCompression(boolean compression) {
		return new BackupSettings(directory, maxBackups, retentionDays, compression, toolTimeout, pgDumpCommand, psqlCommand);
	}

	public BackupSettings withTools(String pgDumpCommand, String psqlCommand, Duration toolTimeout) {
		return new BackupSettings(directory, maxBackups, retentionDays, compression, toolTimeout, pgDumpCommand, psqlCommand);
	}
}
