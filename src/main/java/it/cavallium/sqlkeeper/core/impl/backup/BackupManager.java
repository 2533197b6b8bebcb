package it.cavallium.sqlkeeper.core.impl.backup;

import static it.cavallium.sqlkeeper.core.common.Utils.quoteIdentifier;

import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.SqlExecutor;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.common.SqlStatements;
import it.cavallium.sqlkeeper.core.common.Utils;
import it.cavallium.sqlkeeper.core.impl.SqliteFiles;
import it.cavallium.sqlkeeper.core.impl.Timers;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, lists, restores and expires database backups.
 * <p>
 * Embedded databases are checkpointed and copied as files; server databases are dumped with {@code pg_dump} and
 * restored with {@code psql}. Metadata lives in the {@value #BACKUPS_META_TABLE} table of the database itself.
 */
public class BackupManager implements Closeable {

	public static final String BACKUPS_META_TABLE = "_sqlkeeper_backups";

	private final DatabaseAdapter adapter;
	private final BackupSettings settings;
	private final Clock clock;
	private final Logger logger;
	private final List<ScheduleHandle> schedules = new CopyOnWriteArrayList<>();
	private volatile int retentionDays;
	private volatile boolean initialized;
	private ScheduledExecutorService timer;

	public BackupManager(DatabaseAdapter adapter, BackupSettings settings) {
		this(adapter, settings, Clock.systemUTC());
	}

	public BackupManager(DatabaseAdapter adapter, BackupSettings settings, Clock clock) {
		if (settings.maxBackups() < 1) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_RETENTION, "maxBackups must be at least 1");
		}
		if (settings.retentionDays() < 1) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_RETENTION, "retentionDays must be at least 1");
		}
		this.adapter = adapter;
		this.settings = settings;
		this.clock = clock;
		this.retentionDays = settings.retentionDays();
		this.logger = LoggerFactory.getLogger("db.backups");
	}

	private void ensureInit() {
		if (initialized) {
			return;
		}
		synchronized (this) {
			if (initialized) {
				return;
			}
			try {
				Files.createDirectories(settings.directory());
			} catch (IOException e) {
				throw SqlKeeperException.of(SqlKeeperErrorType.BACKUP_FAILED, "Can't create " + settings.directory(), e);
			}
			ensureMetaTable();
			initialized = true;
		}
	}

	private void ensureMetaTable() {
		adapter.execute("CREATE TABLE IF NOT EXISTS " + quoteIdentifier(BACKUPS_META_TABLE) + " ("
				+ "id TEXT PRIMARY KEY, "
				+ "label TEXT NOT NULL, "
				+ "filepath TEXT NOT NULL, "
				+ "size_bytes INTEGER NOT NULL, "
				+ "created_at TEXT NOT NULL, "
				+ "type TEXT NOT NULL, "
				+ "checksum TEXT NOT NULL)");
	}

	private boolean isLocal() {
		return adapter.getInfo().isLocal();
	}

	private Path databasePath() {
		return Path.of(adapter.getInfo().database());
	}

	private String generateBackupId(Instant now) {
		var timestamp = Utils.formatTimestamp(now).replace(':', '-').replace('.', '-');
		var suffix = new byte[4];
		ThreadLocalRandom.current().nextBytes(suffix);
		return "backup-" + timestamp + "-" + HexFormat.of().formatHex(suffix);
	}

	private static String fileChecksum(Path file) throws IOException {
		return MoreFiles.asByteSource(file).hash(Hashing.sha256()).toString().substring(0, 16);
	}

	public BackupInfo create() {
		return create(null);
	}

	public BackupInfo create(@Nullable String label) {
		return create(label, BackupType.MANUAL);
	}

	/**
	 * Take a backup and apply the retention policy
	 */
	public synchronized BackupInfo create(@Nullable String label, BackupType type) {
		var info = takeBackup(label, type);
		enforceRetention();
		return info;
	}

	private BackupInfo takeBackup(@Nullable String label, BackupType type) {
		ensureInit();
		var now = clock.instant();
		var id = generateBackupId(now);
		var effectiveLabel = label != null && !label.isBlank() ? label : "Backup " + Utils.formatTimestamp(now);
		Path file;
		if (isLocal()) {
			file = settings.directory().resolve(id + (settings.compression() ? ".db.gz" : ".db"));
			try {
				adapter.execute("PRAGMA wal_checkpoint(TRUNCATE)");
			} catch (SqlKeeperException e) {
				logger.debug("WAL checkpoint before backup failed: {}", e.getMessage());
			}
			try {
				if (settings.compression()) {
					gzip(databasePath(), file);
				} else {
					Files.copy(databasePath(), file, StandardCopyOption.REPLACE_EXISTING);
				}
			} catch (IOException e) {
				Utils.deleteBestEffort(file, logger);
				throw SqlKeeperException.of(SqlKeeperErrorType.BACKUP_FAILED, "Can't copy database to " + file, e);
			}
		} else {
			file = settings.directory().resolve(id + ".sql");
			try {
				ExternalProcess.run(List.of(settings.pgDumpCommand(), adapter.getInfo().database(), "--no-owner", "--no-privileges"),
						null, file, settings.toolTimeout());
			} catch (SqlKeeperException e) {
				Utils.deleteBestEffort(file, logger);
				throw e;
			}
		}

		BackupInfo info;
		try {
			info = new BackupInfo(id, effectiveLabel, file, Files.size(file), now, type, fileChecksum(file));
		} catch (IOException e) {
			Utils.deleteBestEffort(file, logger);
			throw SqlKeeperException.of(SqlKeeperErrorType.BACKUP_FAILED, "Can't read backup file " + file, e);
		}
		insertMetadata(adapter, info);
		logger.info("Backup created: {} ({} bytes, {})", id, info.sizeBytes(), type.id());
		return info;
	}

	private static void insertMetadata(SqlExecutor executor, BackupInfo info) {
		executor.execute("INSERT INTO " + quoteIdentifier(BACKUPS_META_TABLE)
						+ " (id, label, filepath, size_bytes, created_at, type, checksum)"
						+ " VALUES ($1, $2, $3, $4, $5, $6, $7)",
				List.of(info.id(),
						info.label(),
						info.filepath().toString(),
						info.sizeBytes(),
						Utils.formatTimestamp(info.createdAt()),
						info.type().id(),
						info.checksum()));
	}

	/**
	 * @return every backup, newest first
	 */
	public List<BackupInfo> list() {
		ensureInit();
		var rows = adapter.query("SELECT id, label, filepath, size_bytes, created_at, type, checksum FROM "
				+ quoteIdentifier(BACKUPS_META_TABLE) + " ORDER BY created_at DESC, id DESC").rows();
		var backups = new ArrayList<BackupInfo>(rows.size());
		for (Map<String, Object> row : rows) {
			backups.add(BackupInfo.fromRow(row));
		}
		return backups;
	}

	public @Nullable BackupInfo get(String id) {
		ensureInit();
		var row = adapter.queryOne("SELECT id, label, filepath, size_bytes, created_at, type, checksum FROM "
				+ quoteIdentifier(BACKUPS_META_TABLE) + " WHERE id = $1", List.of(id));
		return row != null ? BackupInfo.fromRow(row) : null;
	}

	/**
	 * Replace the live database with a backup. A {@link BackupType#PRE_RESTORE} backup of the current state is
	 * taken first.
	 */
	public synchronized void restore(String id) {
		ensureInit();
		var backup = get(id);
		if (backup == null) {
			throw SqlKeeperException.of(SqlKeeperErrorType.BACKUP_NOT_FOUND, "Backup not found: " + id);
		}
		if (!Files.exists(backup.filepath())) {
			throw SqlKeeperException.of(SqlKeeperErrorType.BACKUP_FILE_MISSING, "Backup file missing: " + backup.filepath());
		}

		// retention runs after the swap, so it can't remove the backup being restored
		var preRestore = takeBackup("Pre-restore snapshot before restoring " + id, BackupType.PRE_RESTORE);
		logger.info("Pre-restore backup created: {}", preRestore.id());
		var known = list();

		if (isLocal()) {
			var databasePath = databasePath();
			try {
				adapter.offline(() -> {
					var staging = databasePath.resolveSibling(databasePath.getFileName() + ".restoring");
					if (backup.isCompressed()) {
						gunzip(backup.filepath(), staging);
					} else {
						Files.copy(backup.filepath(), staging, StandardCopyOption.REPLACE_EXISTING);
					}
					Files.move(staging, databasePath, StandardCopyOption.REPLACE_EXISTING);
					SqliteFiles.deleteSidecars(databasePath);
				});
			} catch (IOException e) {
				throw SqlKeeperException.of(SqlKeeperErrorType.FILE_OPERATION_FAILED, "Can't restore backup " + id, e);
			}
		} else {
			ExternalProcess.run(List.of(settings.psqlCommand(), "-q", adapter.getInfo().database()),
					backup.filepath(), null, settings.toolTimeout());
		}

		// rows listed before the swap are authoritative
		ensureMetaTable();
		adapter.transaction(tx -> {
			tx.execute("DELETE FROM " + quoteIdentifier(BACKUPS_META_TABLE));
			for (BackupInfo info : known) {
				insertMetadata(tx, info);
			}
			return null;
		});
		logger.info("Restored from backup: {}", id);
		enforceRetention();
	}

	/**
	 * Delete a backup file and its metadata. File removal is best-effort.
	 */
	public synchronized void delete(String id) {
		ensureInit();
		var backup = get(id);
		if (backup == null) {
			throw SqlKeeperException.of(SqlKeeperErrorType.BACKUP_NOT_FOUND, "Backup not found: " + id);
		}
		Utils.deleteBestEffort(backup.filepath(), logger);
		adapter.execute("DELETE FROM " + quoteIdentifier(BACKUPS_META_TABLE) + " WHERE id = $1", List.of(id));
		logger.info("Backup deleted: {}", id);
	}

	public ScheduleHandle schedule(String cron) {
		return schedule(CronInterval.parse(cron));
	}

	/**
	 * Take a {@link BackupType#SCHEDULED} backup at a fixed interval. A failed tick is logged and the schedule
	 * keeps running.
	 */
	public ScheduleHandle schedule(CronInterval interval) {
		var handle = new ScheduleHandle(interval, clock, logger);
		var label = "Scheduled backup (" + interval.cron() + ")";
		long periodMs = interval.intervalMs();
		var future = getTimer().scheduleAtFixedRate(() -> {
			handle.onTick();
			try {
				create(label, BackupType.SCHEDULED);
			} catch (Exception e) {
				logger.error("Scheduled backup failed", e);
			}
		}, periodMs, periodMs, TimeUnit.MILLISECONDS);
		handle.attach(future);
		schedules.add(handle);
		logger.info("Backup scheduled: {} (every {}s)", interval.cron(), periodMs / 1000);
		return handle;
	}

	private synchronized ScheduledExecutorService getTimer() {
		if (timer == null) {
			timer = Timers.newTimer("backup-schedule");
		}
		return timer;
	}

	public RetentionPolicy getRetentionPolicy() {
		return new RetentionPolicy(settings.maxBackups(), retentionDays);
	}

	public void setRetentionPolicy(int retentionDays) {
		if (retentionDays < 1) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_RETENTION, "Retention must be at least 1 day, got " + retentionDays);
		}
		this.retentionDays = retentionDays;
		logger.info("Retention policy updated: {} days", retentionDays);
	}

	/**
	 * Delete the backups selected by the retention policy
	 * @return the deleted backups
	 */
	public synchronized List<BackupInfo> enforceRetention() {
		var expired = getRetentionPolicy().selectExpired(list(), clock.instant());
		for (BackupInfo backup : expired) {
			Utils.deleteBestEffort(backup.filepath(), logger);
			adapter.execute("DELETE FROM " + quoteIdentifier(BACKUPS_META_TABLE) + " WHERE id = $1", List.of(backup.id()));
		}
		if (!expired.isEmpty()) {
			logger.info("Retention: removed {} old backup(s)", expired.size());
		}
		return expired;
	}

	/**
	 * Dump the database as SQL text
	 */
	public String exportSql() {
		ensureInit();
		if (!isLocal()) {
			return ExternalProcess.run(List.of(settings.pgDumpCommand(), adapter.getInfo().database(), "--no-owner", "--no-privileges"),
					null, null, settings.toolTimeout());
		}

		var lines = new ArrayList<String>();
		var tables = adapter.query("SELECT name, sql FROM sqlite_master WHERE type = 'table'"
				+ " AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\' ORDER BY name").rows();
		for (Map<String, Object> table : tables) {
			var name = String.valueOf(table.get("name"));
			lines.add(ifNotExists(String.valueOf(table.get("sql")), "CREATE TABLE ") + ";");
			lines.add("");
			for (Map<String, Object> row : adapter.query("SELECT * FROM " + quoteIdentifier(name)).rows()) {
				var columns = new ArrayList<String>(row.size());
				var values = new ArrayList<String>(row.size());
				for (Map.Entry<String, Object> entry : row.entrySet()) {
					columns.add(quoteIdentifier(entry.getKey()));
					values.add(toSqlLiteral(entry.getValue()));
				}
				lines.add("INSERT INTO " + quoteIdentifier(name) + " (" + String.join(", ", columns) + ") VALUES ("
						+ String.join(", ", values) + ");");
			}
			lines.add("");
		}
		var indexes = adapter.query("SELECT sql FROM sqlite_master WHERE type = 'index' AND sql IS NOT NULL ORDER BY name").rows();
		for (Map<String, Object> index : indexes) {
			var sql = String.valueOf(index.get("sql"));
			sql = ifNotExists(ifNotExists(sql, "CREATE INDEX "), "CREATE UNIQUE INDEX ");
			lines.add(sql + ";");
		}
		return String.join("\n", lines);
	}

	private static String ifNotExists(String createSql, String prefix) {
		if (createSql.regionMatches(true, 0, prefix, 0, prefix.length())
				&& !createSql.regionMatches(true, prefix.length(), "IF NOT EXISTS", 0, "IF NOT EXISTS".length())) {
			return prefix + "IF NOT EXISTS " + createSql.substring(prefix.length());
		}
		return createSql;
	}

	static String toSqlLiteral(@Nullable Object value) {
		if (value == null) {
			return "NULL";
		} else if (value instanceof Number) {
			return String.valueOf(value);
		} else if (value instanceof Boolean bool) {
			return bool ? "1" : "0";
		} else if (value instanceof byte[] bytes) {
			return "X'" + HexFormat.of().formatHex(bytes) + "'";
		} else {
			return Utils.quoteLiteral(String.valueOf(value));
		}
	}

	/**
	 * Execute a SQL script. Statements run one by one, without an enclosing transaction.
	 * @return the number of statements executed, or -1 when the script was handed to {@code psql}
	 */
	public int importSql(String sql) {
		ensureInit();
		if (!isLocal()) {
			Path script = settings.directory().resolve("import-" + clock.millis() + ".sql");
			try {
				Files.writeString(script, sql, StandardCharsets.UTF_8);
				ExternalProcess.run(List.of(settings.psqlCommand(), "-q", adapter.getInfo().database()), script, null,
						settings.toolTimeout());
			} catch (IOException e) {
				throw SqlKeeperException.of(SqlKeeperErrorType.FILE_OPERATION_FAILED, "Can't write " + script, e);
			} finally {
				Utils.deleteBestEffort(script, logger);
			}
			logger.info("SQL import complete (server)");
			return -1;
		}
		var statements = SqlStatements.split(sql);
		for (String statement : statements) {
			adapter.execute(statement);
		}
		logger.info("SQL import complete: {} statement(s)", statements.size());
		return statements.size();
	}

	/**
	 * Restore the latest backup taken at or before {@code target}.
	 * Changes between that backup and {@code target} can't be recovered from backups alone.
	 */
	public synchronized PointInTimeRestoreResult pointInTimeRestore(Instant target) {
		var backups = list();
		BackupInfo candidate = null;
		for (BackupInfo backup : backups) {
			if (!backup.createdAt().isAfter(target)) {
				candidate = backup;
				break;
			}
		}
		if (candidate == null) {
			var earliest = backups.isEmpty() ? "none" : Utils.formatTimestamp(backups.get(backups.size() - 1).createdAt());
			throw SqlKeeperException.of(SqlKeeperErrorType.BACKUP_NOT_FOUND, "No backup found before "
					+ Utils.formatTimestamp(target) + ". Earliest backup: " + earliest);
		}
		logger.info("Point-in-time restore: using backup {} from {} for target {}", candidate.id(),
				Utils.formatTimestamp(candidate.createdAt()), Utils.formatTimestamp(target));
		var window = Duration.between(candidate.createdAt(), target);
		if (!window.isZero()) {
			logger.warn("Changes made between {} and {} are not included in the backup and may be lost",
					Utils.formatTimestamp(candidate.createdAt()), Utils.formatTimestamp(target));
		}
		restore(candidate.id());
		return new PointInTimeRestoreResult(candidate, target, window);
	}

	public WalStatus getWalStatus() {
		ensureInit();
		if (!isLocal()) {
			try {
				var row = adapter.queryOne("SELECT pg_current_wal_lsn()::text AS current_wal_lsn");
				return new WalStatus(true, true, 0, row != null ? "Current WAL LSN: " + row.get("current_wal_lsn") : "Unknown");
			} catch (SqlKeeperException e) {
				logger.debug("WAL status query failed: {}", e.getMessage());
				return new WalStatus(true, true, 0, "Could not query WAL status");
			}
		}

		boolean walMode;
		try {
			var row = adapter.queryOne("PRAGMA journal_mode");
			walMode = row != null && "wal".equalsIgnoreCase(String.valueOf(row.get("journal_mode")));
		} catch (SqlKeeperException e) {
			walMode = false;
		}
		var walPath = SqliteFiles.walPath(databasePath());
		boolean walFileExists = Files.exists(walPath);
		long walSizeBytes = 0;
		if (walFileExists) {
			try {
				walSizeBytes = Files.size(walPath);
			} catch (IOException e) {
				walSizeBytes = 0;
			}
		}
		String checkpointInfo;
		try {
			var row = adapter.queryOne("PRAGMA wal_checkpoint(PASSIVE)");
			checkpointInfo = row != null
					? "busy=" + row.get("busy") + ", log=" + row.get("log") + ", checkpointed=" + row.get("checkpointed")
					: "No checkpoint data";
		} catch (SqlKeeperException e) {
			checkpointInfo = "Checkpoint query failed";
		}
		return new WalStatus(walMode, walFileExists, walSizeBytes, checkpointInfo);
	}

	public List<ScheduleHandle> getSchedules() {
		return List.copyOf(schedules);
	}

	/**
	 * Stop every schedule created by this manager
	 */
	@Override
	public void close() {
		for (ScheduleHandle schedule : schedules) {
			schedule.stop();
		}
		schedules.clear();
		ScheduledExecutorService timerToStop;
		synchronized (this) {
			timerToStop = timer;
			timer = null;
		}
		if (timerToStop != null) {
			Timers.shutdown(timerToStop);
		}
	}

	private static void gzip(Path source, Path target) throws IOException {
		try (InputStream in = Files.newInputStream(source);
				OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
			in.transferTo(out);
		}
	}

	private static void gunzip(Path source, Path target) throws IOException {
		try (InputStream in = new GZIPInputStream(Files.newInputStream(source));
				OutputStream out = Files.newOutputStream(target)) {
			in.transferTo(out);
		}
	}
}
