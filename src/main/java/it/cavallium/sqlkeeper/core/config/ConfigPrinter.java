package it.cavallium.sqlkeeper.core.config;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import org.github.gestalt.config.exceptions.GestaltException;

public class ConfigPrinter {

	public static String stringify(SqlKeeperConfig config) {
		try {
			return stringifySqlKeeper(config);
		} catch (GestaltException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.CONFIG_ERROR, "Can't stringify config", e);
		}
	}

	public static String stringifySqlKeeper(SqlKeeperConfig o) throws GestaltException {
		return """
				{
				  "database": %s,
				  "migrations": %s,
				  "backups": %s,
				  "replicas": %s,
				  "realtime": %s
				}""".formatted(stringifyDatabase(o.database()),
				stringifyMigrations(o.migrations()),
				stringifyBackups(o.backups()),
				stringifyReplicas(o.replicas()),
				stringifyRealtime(o.realtime()));
	}

	public static String stringifyDatabase(DatabaseConnectionConfig o) throws GestaltException {
		return """
				{
				    "url": "%s",
				    "log-requests": %b
				  }\
				""".formatted(o.url(), o.logRequests());
	}

	public static String stringifyMigrations(MigrationsConfig o) throws GestaltException {
		return """
				{
				    "directory": "%s",
				    "lock-stale-timeout": "%s"
				  }\
				""".formatted(o.directory(), o.lockStaleTimeout());
	}

	public static String stringifyBackups(BackupsConfig o) throws GestaltException {
		return """
				{
				    "directory": "%s",
				    "max-backups": %d,
				    "retention-days": %d,
				    "compression": %b,
				    "external-tool-timeout": "%s",
				    "pg-dump-command": "%s",
				    "psql-command": "%s"
				  }\
				""".formatted(o.directory(),
				o.maxBackups(),
				o.retentionDays(),
				o.compression(),
				o.externalToolTimeout(),
				o.pgDumpCommand(),
				o.psqlCommand());
	}

	public static String stringifyReplicas(ReplicasConfig o) throws GestaltException {
		return """
				{
				    "directory": "%s",
				    "sync-interval": "%s"
				  }\
				""".formatted(o.directory(), o.syncInterval());
	}

	public static String stringifyRealtime(RealtimeConfig o) throws GestaltException {
		return """
				{
				    "poll-interval": "%s",
				    "presence-heartbeat": "%s",
				    "presence-timeout": "%s"
				  }\
				""".formatted(o.pollInterval(), o.presenceHeartbeat(), o.presenceTimeout());
	}
}
