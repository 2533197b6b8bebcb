package it.cavallium.sqlkeeper.core.impl.migration;

import static it.cavallium.sqlkeeper.core.common.Utils.quoteIdentifier;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.common.Utils;
import it.cavallium.sqlkeeper.core.impl.SchemaCatalog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies, reverts and inspects versioned schema migrations.
 * <p>
 * Migrations come from {@code <version>_<name>.sql} files in the migrations directory and from an optional
 * {@link MigrationRegistry}. Applied versions are recorded in {@value #MIGRATIONS_TABLE}; each migration runs in
 * the same transaction as its bookkeeping row. Calls on one manager are serialized, and {@link #lock()} offers
 * a mutex shared by every process using the same database.
 */
public class MigrationManager {

	public static final String MIGRATIONS_TABLE = "_sqlkeeper_migrations";
	public static final String LOCK_TABLE = "_sqlkeeper_migration_lock";

	private static final Pattern FILE_NAME = Pattern.compile("^(\\d{14})_(.+)\\.sql$");
	private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

	private static final Pattern CREATE_TABLE = Pattern.compile(
			"CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?\"?(\\w+)\"?", Pattern.CASE_INSENSITIVE);
	private static final Pattern DROP_TABLE = Pattern.compile(
			"DROP\\s+TABLE\\s+(?:IF\\s+EXISTS\\s+)?\"?(\\w+)\"?", Pattern.CASE_INSENSITIVE);
	private static final Pattern ADD_COLUMN = Pattern.compile(
			"ALTER\\s+TABLE\\s+\"?(\\w+)\"?\\s+ADD\\s+COLUMN\\s+\"?(\\w+)\"?\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
	private static final Pattern DROP_COLUMN = Pattern.compile(
			"ALTER\\s+TABLE\\s+\"?(\\w+)\"?\\s+DROP\\s+COLUMN\\s+(?:IF\\s+EXISTS\\s+)?\"?(\\w+)\"?", Pattern.CASE_INSENSITIVE);

	private final DatabaseAdapter adapter;
	private final Path directory;
	private final Duration lockStaleTimeout;
	private final MigrationRegistry registry;
	private final Clock clock;
	private final String lockOwner;
	private final Logger logger;
	private volatile boolean initialized;

	public MigrationManager(DatabaseAdapter adapter, MigrationSettings settings) {
		this(adapter, settings, new MigrationRegistry());
	}

	public MigrationManager(DatabaseAdapter adapter, MigrationSettings settings, MigrationRegistry registry) {
		this(adapter, settings, registry, Clock.systemDefaultZone());
	}

	public MigrationManager(DatabaseAdapter adapter, MigrationSettings settings, MigrationRegistry registry, Clock clock) {
		this.adapter = adapter;
		this.directory = settings.directory();
		this.lockStaleTimeout = settings.lockStaleTimeout();
		this.registry = registry;
		this.clock = clock;
		this.lockOwner = "pid-" + ProcessHandle.current().pid();
		this.logger = LoggerFactory.getLogger("db.migrations");
	}

	private void ensureInit() {
		if (initialized) {
			return;
		}
		synchronized (this) {
			if (initialized) {
				return;
			}
			adapter.execute("CREATE TABLE IF NOT EXISTS " + quoteIdentifier(MIGRATIONS_TABLE) + " ("
					+ "version TEXT PRIMARY KEY, "
					+ "name TEXT NOT NULL, "
					+ "applied_at TEXT NOT NULL, "
					+ "checksum TEXT NOT NULL DEFAULT '')");
			adapter.execute("CREATE TABLE IF NOT EXISTS " + quoteIdentifier(LOCK_TABLE) + " ("
					+ "id INTEGER PRIMARY KEY CHECK (id = 1), "
					+ "locked_at TEXT, "
					+ "locked_by TEXT)");
			adapter.execute("INSERT INTO " + quoteIdentifier(LOCK_TABLE)
					+ " (id, locked_at, locked_by) VALUES (1, NULL, NULL) ON CONFLICT (id) DO NOTHING");
			initialized = true;
		}
	}

	public Path getDirectory() {
		return directory;
	}

	public String getLockOwner() {
		return lockOwner;
	}

	/**
	 * Lowercase the name and collapse every run of characters outside {@code [a-z0-9]} into one underscore
	 */
	public static String sanitizeName(String name) {
		var sanitized = name.toLowerCase().replaceAll("[^a-z0-9]+", "_");
		int start = sanitized.startsWith("_") ? 1 : 0;
		int end = sanitized.length() > start && sanitized.endsWith("_") ? sanitized.length() - 1 : sanitized.length();
		return sanitized.substring(start, end);
	}

	/**
	 * Write an empty migration file named after the current time.
	 * If a migration with the same second already exists the timestamp is moved forward until it is unique.
	 */
	public synchronized Path generate(String name) {
		var sanitized = sanitizeName(name);
		if (sanitized.isEmpty()) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Invalid migration name: \"" + name + "\"");
		}
		try {
			Files.createDirectories(directory);
			var taken = new HashSet<String>();
			for (MigrationFile file : discover()) {
				taken.add(file.version());
			}
			var time = LocalDateTime.now(clock).withNano(0);
			var version = VERSION_FORMAT.format(time);
			while (taken.contains(version)) {
				time = time.plusSeconds(1);
				version = VERSION_FORMAT.format(time);
			}
			var file = directory.resolve(version + "_" + sanitized + ".sql");
			var content = SqlFileMigration.render("-- Migration: " + sanitized + "\n-- Created at: "
							+ Utils.formatTimestamp(clock.instant()),
					"-- Write the forward migration here",
					"-- Write the rollback here");
			Files.writeString(file, content, StandardOpenOption.CREATE_NEW);
			logger.info("Generated: {}", file.getFileName());
			return file;
		} catch (IOException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_FILE_ERROR, "Can't write migration " + sanitized, e);
		}
	}

	/**
	 * @return migration files and registered migrations, sorted by version
	 */
	public List<MigrationFile> discover() {
		var byVersion = new TreeMap<String, MigrationFile>();
		if (Files.isDirectory(directory)) {
			List<Path> paths;
			try (var stream = Files.list(directory)) {
				paths = stream.filter(Files::isRegularFile).toList();
			} catch (IOException e) {
				throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_LOAD_ERROR, "Can't list " + directory, e);
			}
			for (Path path : paths) {
				Matcher matcher = FILE_NAME.matcher(path.getFileName().toString());
				if (matcher.matches()) {
					addDiscovered(byVersion, MigrationFile.ofPath(matcher.group(1), matcher.group(2), path));
				}
			}
		}
		for (MigrationFile registered : registry.list()) {
			addDiscovered(byVersion, registered);
		}
		return new ArrayList<>(byVersion.values());
	}

	private static void addDiscovered(Map<String, MigrationFile> byVersion, MigrationFile file) {
		var previous = byVersion.putIfAbsent(file.version(), file);
		if (previous != null) {
			throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_LOAD_ERROR,
					"Duplicate migration version " + file.version() + ": " + previous.id() + " and " + file.id());
		}
	}

	/**
	 * @return applied migrations ordered by version
	 */
	public List<MigrationRecord> getApplied() {
		ensureInit();
		var rows = adapter.query("SELECT version, name, applied_at, checksum FROM " + quoteIdentifier(MIGRATIONS_TABLE)
				+ " ORDER BY version ASC").rows();
		var records = new ArrayList<MigrationRecord>(rows.size());
		for (Map<String, Object> row : rows) {
			records.add(MigrationRecord.fromRow(row));
		}
		return records;
	}

	/**
	 * Apply the earliest pending migration
	 * @return the new record, or null if nothing is pending
	 */
	public synchronized @Nullable MigrationRecord up() {
		ensureInit();
		var applied = new HashSet<String>();
		for (MigrationRecord record : getApplied()) {
			applied.add(record.version());
		}
		MigrationFile next = null;
		for (MigrationFile file : discover()) {
			if (!applied.contains(file.version())) {
				next = file;
				break;
			}
		}
		if (next == null) {
			logger.info("No pending migrations");
			return null;
		}

		var migration = next.load();
		var record = new MigrationRecord(next.version(), next.name(), Utils.formatTimestamp(clock.instant()), next.checksum());
		adapter.transaction(tx -> {
			migration.up(tx);
			tx.execute("INSERT INTO " + quoteIdentifier(MIGRATIONS_TABLE) + " (version, name, applied_at, checksum)"
					+ " VALUES ($1, $2, $3, $4)", List.of(record.version(), record.name(), record.appliedAt(), record.checksum()));
			return null;
		});
		logger.info("Applied: {}", next.id());
		return record;
	}

	/**
	 * Apply every pending migration in order. Stops at the first failure, leaving earlier migrations applied.
	 */
	public synchronized List<MigrationRecord> upAll() {
		var results = new ArrayList<MigrationRecord>();
		MigrationRecord record;
		while ((record = up()) != null) {
			results.add(record);
		}
		if (!results.isEmpty()) {
			logger.info("Applied {} migration(s)", results.size());
		}
		return results;
	}

	/**
	 * Revert the applied migration with the highest version.
	 * If its file is gone only the bookkeeping row is removed.
	 * @return the removed record, or null if nothing is applied
	 */
	public synchronized @Nullable MigrationRecord down() {
		ensureInit();
		var applied = getApplied();
		if (applied.isEmpty()) {
			logger.info("No migrations to roll back");
			return null;
		}
		var latest = applied.get(applied.size() - 1);
		MigrationFile file = null;
		for (MigrationFile candidate : discover()) {
			if (candidate.version().equals(latest.version())) {
				file = candidate;
				break;
			}
		}
		var deleteSql = "DELETE FROM " + quoteIdentifier(MIGRATIONS_TABLE) + " WHERE version = $1";
		if (file == null) {
			logger.warn("Migration source for {}_{} not found, removing its record only", latest.version(), latest.name());
			adapter.execute(deleteSql, List.of(latest.version()));
			return latest;
		}
		var migration = file.load();
		adapter.transaction(tx -> {
			migration.down(tx);
			tx.execute(deleteSql, List.of(latest.version()));
			return null;
		});
		logger.info("Rolled back: {}", file.id());
		return latest;
	}

	/**
	 * Revert migrations while the latest applied version is greater than {@code version}.
	 * An empty version or {@code "0"} reverts everything.
	 */
	public synchronized List<MigrationRecord> downTo(String version) {
		ensureInit();
		var target = version == null ? "" : version;
		if (!target.isEmpty() && !target.equals("0") && !isKnownVersion(target)) {
			throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_NOT_FOUND, "Unknown migration version: " + target);
		}
		var results = new ArrayList<MigrationRecord>();
		while (true) {
			var applied = getApplied();
			if (applied.isEmpty() || applied.get(applied.size() - 1).version().compareTo(target) <= 0) {
				break;
			}
			results.add(down());
		}
		return results;
	}

	private boolean isKnownVersion(String version) {
		for (MigrationRecord record : getApplied()) {
			if (record.version().equals(version)) {
				return true;
			}
		}
		for (MigrationFile file : discover()) {
			if (file.version().equals(version)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Merge discovered and applied migrations.
	 * Applied records without a source are listed as applied too.
	 */
	public List<MigrationStatusEntry> status() {
		ensureInit();
		var applied = new LinkedHashMap<String, MigrationRecord>();
		for (MigrationRecord record : getApplied()) {
			applied.put(record.version(), record);
		}
		var entries = new TreeMap<String, MigrationStatusEntry>();
		for (MigrationFile file : discover()) {
			var record = applied.get(file.version());
			entries.put(file.version(), record != null
					? MigrationStatusEntry.applied(file.version(), file.name(), record.appliedAt())
					: MigrationStatusEntry.pending(file.version(), file.name()));
		}
		for (MigrationRecord record : applied.values()) {
			entries.putIfAbsent(record.version(), MigrationStatusEntry.applied(record.version(), record.name(), record.appliedAt()));
		}
		return new ArrayList<>(entries.values());
	}

	/**
	 * Revert every migration, then apply them all again. A failure halfway leaves a partially migrated schema.
	 */
	public synchronized List<MigrationRecord> reset() {
		logger.warn("Resetting database: rolling back all migrations");
		int rolledBack = 0;
		while (down() != null) {
			rolledBack++;
		}
		logger.info("Rolled back {} migration(s), re-applying", rolledBack);
		return upAll();
	}

	/**
	 * Estimate the schema changes of the pending migration files by scanning their up sections.
	 * Registered migrations have no SQL text and are skipped.
	 */
	public SchemaDiff diff() {
		ensureInit();
		var tablesAdded = new ArrayList<String>();
		var tablesRemoved = new ArrayList<String>();
		var columnsAdded = new ArrayList<SchemaDiff.ColumnChange>();
		var columnsRemoved = new ArrayList<SchemaDiff.ColumnRef>();
		var sql = new ArrayList<String>();

		var existingTables = new HashSet<>(SchemaCatalog.listTables(adapter));
		var currentSchema = new HashMap<String, Set<String>>();
		for (String table : existingTables) {
			currentSchema.put(table, new HashSet<>(SchemaCatalog.listColumns(adapter, table)));
		}

		var applied = new HashSet<String>();
		for (MigrationRecord record : getApplied()) {
			applied.add(record.version());
		}
		for (MigrationFile file : discover()) {
			if (applied.contains(file.version()) || !file.isFile()) {
				continue;
			}
			String upSql;
			try {
				upSql = ((SqlFileMigration) file.load()).upSql();
			} catch (SqlKeeperException e) {
				logger.debug("Skipping {} in diff: {}", file.id(), e.getMessage());
				continue;
			}

			var matcher = CREATE_TABLE.matcher(upSql);
			while (matcher.find()) {
				var table = matcher.group(1);
				if (!existingTables.contains(table)) {
					tablesAdded.add(table);
					sql.add("-- From migration " + file.id() + ": CREATE TABLE \"" + table + "\" ...");
				}
			}
			matcher = DROP_TABLE.matcher(upSql);
			while (matcher.find()) {
				var table = matcher.group(1);
				if (existingTables.contains(table)) {
					tablesRemoved.add(table);
					sql.add("DROP TABLE IF EXISTS \"" + table + "\";");
				}
			}
			matcher = ADD_COLUMN.matcher(upSql);
			while (matcher.find()) {
				var columns = currentSchema.get(matcher.group(1));
				if (columns != null && !columns.contains(matcher.group(2))) {
					columnsAdded.add(new SchemaDiff.ColumnChange(matcher.group(1), matcher.group(2), matcher.group(3)));
					sql.add("ALTER TABLE \"" + matcher.group(1) + "\" ADD COLUMN \"" + matcher.group(2) + "\" " + matcher.group(3) + ";");
				}
			}
			matcher = DROP_COLUMN.matcher(upSql);
			while (matcher.find()) {
				var columns = currentSchema.get(matcher.group(1));
				if (columns != null && columns.contains(matcher.group(2))) {
					columnsRemoved.add(new SchemaDiff.ColumnRef(matcher.group(1), matcher.group(2)));
					sql.add("ALTER TABLE \"" + matcher.group(1) + "\" DROP COLUMN \"" + matcher.group(2) + "\";");
				}
			}
		}
		return new SchemaDiff(tablesAdded, tablesRemoved, columnsAdded, columnsRemoved, sql);
	}

	/**
	 * Run a seed function. Nothing is wrapped in a transaction.
	 */
	public void seed(SeedFunction seedFunction) {
		ensureInit();
		logger.info("Running seed function...");
		seedFunction.seed(new SeedContext(adapter, logger));
		logger.info("Seed complete");
	}

	/**
	 * Combine every migration file into a single one that is recorded as applied.
	 * The recorded checksums of the applied migrations are verified before anything is changed.
	 * @return the squashed file, or null if there were fewer than two migrations
	 */
	public synchronized @Nullable Path squash() {
		ensureInit();
		if (!registry.isEmpty()) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT,
					"Can't squash while migrations are registered in code, their bodies can't be merged into a file");
		}
		var files = discover();
		if (files.size() <= 1) {
			logger.info("Nothing to squash (0 or 1 migration)");
			return null;
		}

		var appliedByVersion = new HashMap<String, MigrationRecord>();
		for (MigrationRecord record : getApplied()) {
			appliedByVersion.put(record.version(), record);
		}
		var migrations = new ArrayList<SqlFileMigration>(files.size());
		for (MigrationFile file : files) {
			var record = appliedByVersion.get(file.version());
			if (record != null && !record.checksum().isEmpty()) {
				var actual = file.checksum();
				if (!actual.equals(record.checksum())) {
					throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_CHECKSUM_MISMATCH, "Migration " + file.id()
							+ " was modified after being applied (recorded " + record.checksum() + ", found " + actual + ")");
				}
			}
			migrations.add((SqlFileMigration) file.load());
		}
		if (appliedByVersion.size() < files.size()) {
			logger.warn("Squashing {} pending migration(s): they will be recorded as applied without running",
					files.size() - appliedByVersion.size());
		}

		var first = files.get(0);
		var last = files.get(files.size() - 1);
		var up = new StringBuilder();
		var down = new StringBuilder();
		for (int i = 0; i < files.size(); i++) {
			up.append("-- From: ").append(files.get(i).id()).append('\n').append(migrations.get(i).upSql()).append("\n\n");
		}
		for (int i = files.size() - 1; i >= 0; i--) {
			down.append("-- From: ").append(files.get(i).id()).append('\n').append(migrations.get(i).downSql()).append("\n\n");
		}
		var header = "-- Squashed migration combining " + files.size() + " migrations\n"
				+ "-- Original versions: " + first.version() + " through " + last.version() + "\n"
				+ "-- Squashed at: " + Utils.formatTimestamp(clock.instant());

		var taken = new HashSet<String>();
		for (MigrationFile file : files) {
			taken.add(file.version());
		}
		var time = LocalDateTime.now(clock).withNano(0);
		var version = VERSION_FORMAT.format(time);
		while (taken.contains(version)) {
			time = time.plusSeconds(1);
			version = VERSION_FORMAT.format(time);
		}
		var name = "squashed_" + first.version() + "_to_" + last.version();
		var squashedFile = directory.resolve(version + "_" + name + ".sql");
		var content = SqlFileMigration.render(header, up.toString().strip(), down.toString().strip());
		try {
			Files.writeString(squashedFile, content, StandardOpenOption.CREATE_NEW);
		} catch (IOException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_FILE_ERROR, "Can't write squashed migration", e);
		}
		for (MigrationFile file : files) {
			Utils.deleteBestEffort(file.path(), logger);
		}

		var squashed = MigrationFile.ofPath(version, name, squashedFile);
		var record = new MigrationRecord(version, name, Utils.formatTimestamp(clock.instant()), squashed.checksum());
		adapter.transaction(tx -> {
			tx.execute("DELETE FROM " + quoteIdentifier(MIGRATIONS_TABLE));
			tx.execute("INSERT INTO " + quoteIdentifier(MIGRATIONS_TABLE) + " (version, name, applied_at, checksum)"
					+ " VALUES ($1, $2, $3, $4)", List.of(record.version(), record.name(), record.appliedAt(), record.checksum()));
			return null;
		});
		logger.info("Squashed {} migrations into {}", files.size(), squashedFile.getFileName());
		return squashedFile;
	}

	/**
	 * @return applied migrations whose file changed after being applied
	 */
	public List<MigrationRecord> verify() {
		ensureInit();
		var files = new HashMap<String, MigrationFile>();
		for (MigrationFile file : discover()) {
			files.put(file.version(), file);
		}
		var drifted = new ArrayList<MigrationRecord>();
		for (MigrationRecord record : getApplied()) {
			var file = files.get(record.version());
			if (file != null && file.isFile() && !record.checksum().isEmpty() && !record.checksum().equals(file.checksum())) {
				drifted.add(record);
			}
		}
		return drifted;
	}

	/**
	 * Take the migration lock. A lock older than the stale timeout is taken over.
	 * @return false if another holder owns a live lock; retry later
	 */
	public boolean lock() {
		ensureInit();
		var now = clock.instant();
		var current = adapter.queryOne("SELECT locked_at, locked_by FROM " + quoteIdentifier(LOCK_TABLE) + " WHERE id = 1");
		var result = adapter.execute("UPDATE " + quoteIdentifier(LOCK_TABLE) + " SET locked_at = $1, locked_by = $2"
						+ " WHERE id = 1 AND (locked_at IS NULL OR locked_at < $3)",
				List.of(Utils.formatTimestamp(now), lockOwner, Utils.formatTimestamp(now.minus(lockStaleTimeout))));
		if (result.rowCount() == 1) {
			if (current != null && current.get("locked_at") != null) {
				logger.warn("Overriding stale migration lock held by {} since {}", current.get("locked_by"), current.get("locked_at"));
			}
			return true;
		}
		var holder = adapter.queryOne("SELECT locked_at, locked_by FROM " + quoteIdentifier(LOCK_TABLE) + " WHERE id = 1");
		logger.warn("Another process holds the migration lock ({} since {}), wait for it to finish and retry",
				holder != null ? holder.get("locked_by") : "unknown",
				holder != null ? holder.get("locked_at") : "unknown");
		return false;
	}

	public void unlock() {
		ensureInit();
		adapter.execute("UPDATE " + quoteIdentifier(LOCK_TABLE) + " SET locked_at = NULL, locked_by = NULL WHERE id = 1");
	}
}
