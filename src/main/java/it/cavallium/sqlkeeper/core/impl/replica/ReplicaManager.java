package it.cavallium.sqlkeeper.core.impl.replica;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.common.Utils;
import it.cavallium.sqlkeeper.core.impl.SchemaCatalog;
import it.cavallium.sqlkeeper.core.impl.SqliteFiles;
import it.cavallium.sqlkeeper.core.impl.Timers;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a set of read replicas next to a primary database.
 * <p>
 * Embedded replicas are file copies of the primary refreshed by a background timer. Server replicas are plain
 * connections opened through {@link ReplicaSettings#serverAdapterFactory()}: no replication protocol is involved.
 */
public class ReplicaManager implements Closeable {

	public static final String LAG_CANARY_TABLE = SchemaCatalog.INTERNAL_TABLE_PREFIX + "replica_check";

	private final DatabaseAdapter primary;
	private final ReplicaSettings settings;
	private final Clock clock;
	private final Logger logger;
	private final ReentrantLock lock = new ReentrantLock();
	private final Map<String, ReplicaEntry> replicas = new LinkedHashMap<>();
	private int roundRobinIndex;
	private ScheduledExecutorService syncTimer;

	public ReplicaManager(DatabaseAdapter primary, ReplicaSettings settings) {
		this(primary, settings, Clock.systemUTC());
	}

	public ReplicaManager(DatabaseAdapter primary, ReplicaSettings settings, Clock clock) {
		this.primary = primary;
		this.settings = settings;
		this.clock = clock;
		this.logger = LoggerFactory.getLogger("db.replicas");
	}

	private boolean isLocal() {
		return primary.getInfo().isLocal();
	}

	private Path primaryPath() {
		return Path.of(primary.getInfo().database());
	}

	/**
	 * Register a replica. In embedded mode {@code connectionString} is the path of the copy, or blank to keep it
	 * in the replicas directory.
	 */
	public void addReplica(String name, String connectionString) {
		lock.lock();
		try {
			if (replicas.containsKey(name)) {
				throw SqlKeeperException.of(SqlKeeperErrorType.REPLICA_EXISTS, "Replica \"" + name + "\" already exists");
			}
			ReplicaEntry entry;
			if (isLocal()) {
				var replicaPath = connectionString == null || connectionString.isBlank()
						? settings.directory().resolve(name + ".db") : Path.of(connectionString);
				try {
					Files.createDirectories(settings.directory());
				} catch (IOException e) {
					throw SqlKeeperException.of(SqlKeeperErrorType.SYNC_FAILED, "Can't create " + settings.directory(), e);
				}
				try {
					primary.execute("PRAGMA wal_checkpoint(TRUNCATE)");
				} catch (SqlKeeperException e) {
					logger.debug("WAL checkpoint before replica copy failed: {}", e.getMessage());
				}
				long start = clock.millis();
				try {
					SqliteFiles.copyDatabase(primaryPath(), replicaPath);
				} catch (IOException e) {
					throw SqlKeeperException.of(SqlKeeperErrorType.SYNC_FAILED, "Initial sync of replica \"" + name + "\" failed", e);
				}
				entry = new ReplicaEntry(name, replicaPath.toString(), replicaPath,
						settings.embeddedAdapterFactory().open(replicaPath.toString()));
				entry.lagMs = clock.millis() - start;
				entry.lastSyncAt = clock.instant();
				long periodMs = settings.syncInterval().toMillis();
				entry.syncTask = getSyncTimer().scheduleWithFixedDelay(() -> scheduledSync(entry),
						periodMs, periodMs, TimeUnit.MILLISECONDS);
			} else {
				var factory = settings.serverAdapterFactory();
				if (factory == null) {
					throw SqlKeeperException.of(SqlKeeperErrorType.REPLICA_ADAPTER_FACTORY_MISSING,
							"An adapter factory is required for server replicas");
				}
				entry = new ReplicaEntry(name, connectionString, null, factory.open(connectionString));
			}
			replicas.put(name, entry);
			logger.info("Added replica: {}", name);
		} finally {
			lock.unlock();
		}
	}

	private ScheduledExecutorService getSyncTimer() {
		if (syncTimer == null) {
			syncTimer = Timers.newTimer("replica-sync");
		}
		return syncTimer;
	}

	private void scheduledSync(ReplicaEntry entry) {
		if (entry.status != ReplicaStatus.ACTIVE) {
			return;
		}
		try {
			sync(entry);
		} catch (SqlKeeperException e) {
			logger.warn("Sync of replica \"{}\" failed: {}", entry.name, e.getMessage());
		}
	}

	private void sync(ReplicaEntry entry) {
		var replicaPath = entry.path;
		if (replicaPath == null) {
			return;
		}
		long start = clock.millis();
		try {
			entry.adapter.offline(() -> SqliteFiles.copyDatabase(primaryPath(), replicaPath));
		} catch (IOException | RuntimeException e) {
			entry.status = ReplicaStatus.ERROR;
			throw SqlKeeperException.of(SqlKeeperErrorType.SYNC_FAILED, "Sync of replica \"" + entry.name + "\" failed", e);
		}
		entry.lagMs = clock.millis() - start;
		entry.lastSyncAt = clock.instant();
		entry.status = ReplicaStatus.ACTIVE;
	}

	/**
	 * Copy the primary over an embedded replica right away. A stale or failed replica becomes active again.
	 */
	public void syncNow(String name) {
		var entry = getEntry(name);
		if (entry.path == null) {
			logger.info("Replica \"{}\" is a server replica, nothing to sync", name);
			return;
		}
		sync(entry);
		logger.debug("Replica \"{}\" synced in {}ms", name, entry.lagMs);
	}

	/**
	 * Stop syncing a replica, close it and delete its local copy. Cleanup failures are logged only.
	 */
	public void removeReplica(String name) {
		ReplicaEntry entry;
		lock.lock();
		try {
			entry = replicas.remove(name);
			if (entry == null) {
				throw SqlKeeperException.of(SqlKeeperErrorType.REPLICA_NOT_FOUND, "Replica \"" + name + "\" not found");
			}
			if (entry.syncTask != null) {
				entry.syncTask.cancel(false);
				entry.syncTask = null;
			}
		} finally {
			lock.unlock();
		}
		try {
			entry.adapter.close();
		} catch (RuntimeException e) {
			logger.warn("Failed to close replica \"{}\": {}", name, e.getMessage());
		}
		if (entry.path != null) {
			try {
				SqliteFiles.deleteDatabase(entry.path);
			} catch (IOException e) {
				logger.warn("Failed to delete the files of replica \"{}\": {}", name, e.getMessage());
			}
		}
		logger.info("Removed replica: {}", name);
	}

	public List<ReplicaInfo> listReplicas() {
		lock.lock();
		try {
			var result = new ArrayList<ReplicaInfo>(replicas.size());
			for (ReplicaEntry entry : replicas.values()) {
				result.add(entry.toInfo());
			}
			return result;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return an adapter that reads from the replicas and writes to the primary
	 */
	public DatabaseAdapter getReadAdapter() {
		return new ReadSplittingAdapter(primary, this::nextReplica, logger);
	}

	public DatabaseAdapter getWriteAdapter() {
		return primary;
	}

	private @Nullable ReplicaEntry nextReplica() {
		lock.lock();
		try {
			var active = activeReplicas();
			if (active.isEmpty()) {
				return null;
			}
			var replica = active.get(roundRobinIndex % active.size());
			roundRobinIndex = (roundRobinIndex + 1) % active.size();
			return replica;
		} finally {
			lock.unlock();
		}
	}

	private List<ReplicaEntry> activeReplicas() {
		var active = new ArrayList<ReplicaEntry>(replicas.size());
		for (ReplicaEntry entry : replicas.values()) {
			if (entry.status == ReplicaStatus.ACTIVE) {
				active.add(entry);
			}
		}
		return active;
	}

	private ReplicaEntry getEntry(String name) {
		lock.lock();
		try {
			var entry = replicas.get(name);
			if (entry == null) {
				throw SqlKeeperException.of(SqlKeeperErrorType.REPLICA_NOT_FOUND, "Replica \"" + name + "\" not found");
			}
			return entry;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Lag of one replica, or the average over the active ones when {@code name} is null.
	 * <p>
	 * Embedded lag is the duration of the last file copy. Server lag is measured by writing a timestamp to a canary
	 * row of the primary and reading it back from each replica.
	 * @return milliseconds, {@code -1} when every measured replica failed
	 */
	public long getReplicaLag(@Nullable String name) {
		if (name != null) {
			return getEntry(name).lagMs;
		}
		List<ReplicaEntry> active;
		lock.lock();
		try {
			active = activeReplicas();
		} finally {
			lock.unlock();
		}
		if (active.isEmpty()) {
			return 0;
		}
		if (isLocal()) {
			long total = 0;
			for (ReplicaEntry entry : active) {
				total += entry.lagMs;
			}
			return Math.round((double) total / active.size());
		}

		long total = 0;
		int healthy = 0;
		for (ReplicaEntry entry : active) {
			try {
				long start = clock.millis();
				var now = clock.instant();
				primary.execute("CREATE TABLE IF NOT EXISTS " + LAG_CANARY_TABLE
						+ " (id INTEGER PRIMARY KEY CHECK (id = 1), ts TEXT)");
				primary.execute("INSERT INTO " + LAG_CANARY_TABLE + " (id, ts) VALUES (1, $1)"
						+ " ON CONFLICT (id) DO UPDATE SET ts = EXCLUDED.ts", List.of(Utils.formatTimestamp(now)));
				var row = entry.adapter.queryOne("SELECT ts FROM " + LAG_CANARY_TABLE + " WHERE id = 1");
				if (row != null && row.get("ts") != null) {
					var replicaTs = Utils.parseTimestamp(row.get("ts"));
					entry.lagMs = Math.max(0, now.toEpochMilli() - replicaTs.toEpochMilli());
				} else {
					entry.lagMs = clock.millis() - start;
				}
				total += entry.lagMs;
				healthy++;
			} catch (RuntimeException e) {
				entry.lagMs = -1;
				entry.status = ReplicaStatus.ERROR;
				logger.warn("Lag measurement of replica \"{}\" failed: {}", entry.name, e.getMessage());
			}
		}
		return healthy > 0 ? Math.round((double) total / healthy) : -1;
	}

	public long getReplicaLag() {
		return getReplicaLag(null);
	}

	/**
	 * Make a replica the new primary. In embedded mode its file is copied over the primary database; in server mode
	 * the promotion itself has to happen at the infrastructure level and is only logged.
	 * Every other replica becomes {@link ReplicaStatus#INACTIVE}.
	 */
	public void promoteReplica(String name) {
		var entry = getEntry(name);
		if (isLocal()) {
			var replicaPath = entry.path;
			if (replicaPath == null || !Files.exists(replicaPath)) {
				throw SqlKeeperException.of(SqlKeeperErrorType.REPLICA_FILE_MISSING, "Replica file not found: " + replicaPath);
			}
			lock.lock();
			try {
				if (entry.syncTask != null) {
					entry.syncTask.cancel(false);
					entry.syncTask = null;
				}
			} finally {
				lock.unlock();
			}
			var primaryPath = primaryPath();
			try {
				entry.adapter.offline(() -> primary.offline(() -> SqliteFiles.copyDatabase(replicaPath, primaryPath)));
			} catch (IOException e) {
				throw SqlKeeperException.of(SqlKeeperErrorType.FILE_OPERATION_FAILED, "Can't promote replica \"" + name + "\"", e);
			}
			logger.info("Promoted replica \"{}\" to primary (file copy)", name);
		} else {
			logger.info("Replica \"{}\" marked for promotion. The server promotion must be done at the infrastructure level",
					name);
		}

		lock.lock();
		try {
			for (ReplicaEntry other : replicas.values()) {
				if (other != entry) {
					other.status = ReplicaStatus.INACTIVE;
				}
			}
			entry.status = ReplicaStatus.ACTIVE;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Run {@code SELECT 1} on every replica. A success clears an error status, a failure sets it.
	 */
	public List<HealthCheckResult> healthCheck() {
		List<ReplicaEntry> entries;
		lock.lock();
		try {
			entries = new ArrayList<>(replicas.values());
		} finally {
			lock.unlock();
		}
		var results = new ArrayList<HealthCheckResult>(entries.size());
		for (ReplicaEntry entry : entries) {
			long start = clock.millis();
			boolean healthy;
			try {
				entry.adapter.query("SELECT 1");
				healthy = true;
				if (entry.status == ReplicaStatus.ERROR) {
					entry.status = ReplicaStatus.ACTIVE;
				}
			} catch (RuntimeException e) {
				healthy = false;
				entry.status = ReplicaStatus.ERROR;
				logger.warn("Health check of replica \"{}\" failed: {}", entry.name, e.getMessage());
			}
			results.add(new HealthCheckResult(entry.name, healthy, clock.millis() - start));
		}
		return results;
	}

	/**
	 * Remove every replica. The primary stays open.
	 */
	@Override
	public void close() {
		List<String> names;
		lock.lock();
		try {
			names = new ArrayList<>(replicas.keySet());
		} finally {
			lock.unlock();
		}
		for (String name : names) {
			try {
				removeReplica(name);
			} catch (SqlKeeperException e) {
				logger.debug("Replica \"{}\" was already removed", name);
			}
		}
		ScheduledExecutorService timerToStop;
		lock.lock();
		try {
			timerToStop = syncTimer;
			syncTimer = null;
		} finally {
			lock.unlock();
		}
		if (timerToStop != null) {
			Timers.shutdown(timerToStop);
		}
	}
}
