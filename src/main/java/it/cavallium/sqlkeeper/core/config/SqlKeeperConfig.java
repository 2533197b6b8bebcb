package it.cavallium.sqlkeeper.core.config;

import org.github.gestalt.config.exceptions.GestaltException;

public interface SqlKeeperConfig {

	DatabaseConnectionConfig database() throws GestaltException;

	MigrationsConfig migrations() throws GestaltException;

	BackupsConfig backups() throws GestaltException;

	ReplicasConfig replicas() throws GestaltException;

	RealtimeConfig realtime() throws GestaltException;
}
