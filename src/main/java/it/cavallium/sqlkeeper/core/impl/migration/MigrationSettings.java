package it.cavallium.sqlkeeper.core.impl.migration;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.config.MigrationsConfig;
import java.nio.file.Path;
import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

public record MigrationSettings(Path directory, Duration lockStaleTimeout) {

	public static final Path DEFAULT_DIRECTORY = Path.of("./migrations");
	public static final Duration DEFAULT_LOCK_STALE_TIMEOUT = Duration.ofMinutes(10);

	public static MigrationSettings defaults() {
		return new MigrationSettings(DEFAULT_DIRECTORY, DEFAULT_LOCK_STALE_TIMEOUT);
	}

	public static MigrationSettings of(Path directory) {
		return new MigrationSettings(directory, DEFAULT_LOCK_STALE_TIMEOUT);
	}

	public static MigrationSettings of(MigrationsConfig config) {
		try {
			return new MigrationSettings(config.directory(), config.lockStaleTimeout());
		} catch (GestaltException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.CONFIG_ERROR, "Invalid migrations config", e);
		}
	}
}
