package it.cavallium.sqlkeeper.core.impl.replica;

import it.cavallium.sqlkeeper.core.client.JdbcDatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.config.ReplicasConfig;
import java.nio.file.Path;
import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;
import org.jetbrains.annotations.Nullable;

/**
 * @param embeddedAdapterFactory opens the local copy of an embedded replica
 * @param serverAdapterFactory connects to a server replica, required only in server mode
 */
public record ReplicaSettings(Path directory,
		Duration syncInterval,
		ReplicaAdapterFactory embeddedAdapterFactory,
		@Nullable ReplicaAdapterFactory serverAdapterFactory) {

	public static final Path DEFAULT_DIRECTORY = Path.of("./replicas");
	public static final Duration DEFAULT_SYNC_INTERVAL = Duration.ofSeconds(5);

	public static ReplicaSettings defaults() {
		return of(DEFAULT_DIRECTORY);
	}

	public static ReplicaSettings of(Path directory) {
		return new ReplicaSettings(directory,
				DEFAULT_SYNC_INTERVAL,
				connectionString -> JdbcDatabaseAdapter.sqlite(Path.of(connectionString)),
				null);
	}

	public static ReplicaSettings of(ReplicasConfig config) {
		try {
			return of(config.directory()).withSyncInterval(config.syncInterval());
		} catch (GestaltException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.CONFIG_ERROR, "Invalid replicas config", e);
		}
	}

	public ReplicaSettings withSyncInterval(Duration syncInterval) {
		return new ReplicaSettings(directory, syncInterval, embeddedAdapterFactory, serverAdapterFactory);
	}

	public ReplicaSettings withEmbeddedAdapterFactory(ReplicaAdapterFactory embeddedAdapterFactory) {
		return new ReplicaSettings(directory, syncInterval, embeddedAdapterFactory, serverAdapterFactory);
	}

	public ReplicaSettings withServerAdapterFactory(ReplicaAdapterFactory serverAdapterFactory) {
		return new ReplicaSettings(directory, syncInterval, embeddedAdapterFactory, serverAdapterFactory);
	}
}
