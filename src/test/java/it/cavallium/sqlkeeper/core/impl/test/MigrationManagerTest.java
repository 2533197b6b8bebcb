package it.cavallium.sqlkeeper.core.impl.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.cavallium.sqlkeeper.core.client.JdbcDatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.SqlExecutor;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.common.Utils;
import it.cavallium.sqlkeeper.core.impl.SchemaCatalog;
import it.cavallium.sqlkeeper.core.impl.migration.Migration;
import it.cavallium.sqlkeeper.core.impl.migration.MigrationManager;
import it.cavallium.sqlkeeper.core.impl.migration.MigrationRegistry;
import it.cavallium.sqlkeeper.core.impl.migration.MigrationSettings;
import it.cavallium.sqlkeeper.core.impl.migration.MigrationStatus;
import it.cavallium.sqlkeeper.core.impl.migration.SqlFileMigration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrationManagerTest {

	@TempDir
	Path dir;

	private Path migrationsDir;
	private DatabaseAdapter db;
	private MutableClock clock;
	private MigrationRegistry registry;
	private MigrationManager manager;

	@BeforeEach
	void setUp() throws IOException {
		migrationsDir = Files.createDirectories(dir.resolve("migrations"));
		db = JdbcDatabaseAdapter.sqlite(dir.resolve("app.db"));
		clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
		registry = new MigrationRegistry();
		manager = new MigrationManager(db, MigrationSettings.of(migrationsDir), registry, clock);
	}

	@AfterEach
	void tearDown() {
		db.close();
	}

	private Path writeMigration(String fileName, String up, String down) throws IOException {
		return Files.writeString(migrationsDir.resolve(fileName), SqlFileMigration.render("", up, down));
	}

	private boolean tableExists(String table) {
		return SchemaCatalog.listTables(db).contains(table);
	}

	@Test
	void statusBeforeAndAfterUp() throws IOException {
		writeMigration("20240101000000_add_users.sql",
				"CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT);",
				"DROP TABLE users;");

		var before = manager.status();
		assertEquals(1, before.size());
		assertEquals(MigrationStatus.PENDING, before.get(0).status());
		assertNull(before.get(0).appliedAt());

		var record = manager.up();
		assertNotNull(record);
		assertEquals("20240101000000", record.version());
		assertEquals("add_users", record.name());
		assertFalse(record.checksum().isEmpty());
		assertTrue(tableExists("users"));

		var after = manager.status();
		assertEquals(1, after.size());
		assertEquals(MigrationStatus.APPLIED, after.get(0).status());
		assertEquals("2024-03-01T10:00:00.000Z", after.get(0).appliedAt());
	}

	@Test
	void upAllIsIdempotent() throws IOException {
		writeMigration("20240101000000_add_users.sql", "CREATE TABLE users (id INTEGER PRIMARY KEY);", "DROP TABLE users;");
		writeMigration("20240102000000_add_posts.sql", "CREATE TABLE posts (id INTEGER PRIMARY KEY);", "DROP TABLE posts;");

		var applied = manager.upAll();
		assertEquals(List.of("20240101000000", "20240102000000"), applied.stream().map(r -> r.version()).toList());
		assertEquals(List.of(), manager.upAll());
		assertNull(manager.up());
	}

	@Test
	void downRevertsTheHighestVersion() throws IOException {
		writeMigration("20240101000000_add_users.sql", "CREATE TABLE users (id INTEGER PRIMARY KEY);", "DROP TABLE users;");
		writeMigration("20240102000000_add_posts.sql", "CREATE TABLE posts (id INTEGER PRIMARY KEY);", "DROP TABLE posts;");
		manager.upAll();

		var reverted = manager.down();
		assertEquals("20240102000000", reverted.version());
		assertFalse(tableExists("posts"));
		assertTrue(tableExists("users"));
		assertEquals(1, manager.getApplied().size());
	}

	@Test
	void downWithMissingFileRemovesTheRecordOnly() throws IOException {
		var file = writeMigration("20240101000000_add_users.sql",
				"CREATE TABLE users (id INTEGER PRIMARY KEY);", "DROP TABLE users;");
		manager.up();
		Files.delete(file);

		var reverted = manager.down();
		assertEquals("20240101000000", reverted.version());
		assertTrue(manager.getApplied().isEmpty());
		assertTrue(tableExists("users"));
	}

	@Test
	void downOnEmptyHistory() {
		assertNull(manager.down());
	}

	@Test
	void downToStopsAtTheTarget() throws IOException {
		writeMigration("20240101000000_a.sql", "CREATE TABLE a (id INTEGER);", "DROP TABLE a;");
		writeMigration("20240102000000_b.sql", "CREATE TABLE b (id INTEGER);", "DROP TABLE b;");
		writeMigration("20240103000000_c.sql", "CREATE TABLE c (id INTEGER);", "DROP TABLE c;");
		manager.upAll();

		var reverted = manager.downTo("20240101000000");
		assertEquals(List.of("20240103000000", "20240102000000"), reverted.stream().map(r -> r.version()).toList());
		assertTrue(tableExists("a"));
		assertFalse(tableExists("b"));

		var ex = assertThrows(SqlKeeperException.class, () -> manager.downTo("20991231000000"));
		assertEquals(SqlKeeperErrorType.MIGRATION_NOT_FOUND, ex.getErrorUniqueId());

		assertEquals(1, manager.downTo("0").size());
		assertTrue(manager.getApplied().isEmpty());
	}

	@Test
	void failedMigrationLeavesNoTrace() throws IOException {
		writeMigration("20240101000000_broken.sql",
				"CREATE TABLE half (id INTEGER);\nINSERT INTO does_not_exist VALUES (1);",
				"DROP TABLE half;");

		assertThrows(SqlKeeperException.class, manager::up);
		assertFalse(tableExists("half"));
		assertTrue(manager.getApplied().isEmpty());
	}

	@Test
	void orphanRecordsAreReportedAsApplied() throws IOException {
		var file = writeMigration("20240101000000_add_users.sql", "CREATE TABLE users (id INTEGER);", "DROP TABLE users;");
		manager.up();
		Files.delete(file);

		var status = manager.status();
		assertEquals(1, status.size());
		assertEquals(MigrationStatus.APPLIED, status.get(0).status());
		assertEquals("add_users", status.get(0).name());
	}

	@Test
	void generateCreatesUniqueVersions() throws IOException {
		var first = manager.generate("Add Users!");
		var second = manager.generate("add users");
		assertEquals("20240301100000_add_users.sql", first.getFileName().toString());
		assertEquals("20240301100001_add_users.sql", second.getFileName().toString());

		var parsed = SqlFileMigration.parse(first.getFileName().toString(), Files.readString(first));
		assertTrue(parsed.upSql().startsWith("--"));
		// empty stubs apply cleanly
		assertEquals(2, manager.upAll().size());

		var ex = assertThrows(SqlKeeperException.class, () -> manager.generate("!!!"));
		assertEquals(SqlKeeperErrorType.INVALID_ARGUMENT, ex.getErrorUniqueId());
	}

	@Test
	void sanitizeName() {
		assertEquals("add_users_table", MigrationManager.sanitizeName("  Add users-table  "));
		assertEquals("v2_fix", MigrationManager.sanitizeName("V2__fix"));
	}

	@Test
	void registeredMigrationsRunInVersionOrder() throws IOException {
		writeMigration("20240101000000_add_roles.sql", "CREATE TABLE roles (name TEXT PRIMARY KEY);", "DROP TABLE roles;");
		registry.register("20240102000000", "seed_roles", new Migration() {
			@Override
			public void up(SqlExecutor db) {
				db.execute("INSERT INTO roles (name) VALUES ($1), ($2)", List.of("admin", "user"));
			}

			@Override
			public void down(SqlExecutor db) {
				db.execute("DELETE FROM roles");
			}
		});

		assertEquals(2, manager.upAll().size());
		assertEquals(2, db.query("SELECT * FROM roles").rowCount());
		assertEquals("", manager.getApplied().get(1).checksum());

		manager.down();
		assertEquals(0, db.query("SELECT * FROM roles").rowCount());
	}

	@Test
	void duplicateVersionsAreRejected() throws IOException {
		writeMigration("20240101000000_one.sql", "SELECT 1;", "");
		writeMigration("20240101000000_two.sql", "SELECT 2;", "");
		var ex = assertThrows(SqlKeeperException.class, manager::discover);
		assertEquals(SqlKeeperErrorType.MIGRATION_LOAD_ERROR, ex.getErrorUniqueId());
	}

	@Test
	void missingSectionIsALoadError() throws IOException {
		Files.writeString(migrationsDir.resolve("20240101000000_no_down.sql"), "-- migrate:up\nCREATE TABLE x (id INTEGER);\n");
		var ex = assertThrows(SqlKeeperException.class, manager::up);
		assertEquals(SqlKeeperErrorType.MIGRATION_LOAD_ERROR, ex.getErrorUniqueId());
	}

	@Test
	void resetReappliesEverything() throws IOException {
		writeMigration("20240101000000_add_users.sql", "CREATE TABLE users (id INTEGER PRIMARY KEY);", "DROP TABLE users;");
		manager.upAll();
		db.execute("INSERT INTO users (id) VALUES (1)");

		assertEquals(1, manager.reset().size());
		assertEquals(0, db.query("SELECT * FROM users").rowCount());
	}

	@Test
	void verifyReportsModifiedFiles() throws IOException {
		var file = writeMigration("20240101000000_add_users.sql", "CREATE TABLE users (id INTEGER);", "DROP TABLE users;");
		manager.up();
		assertTrue(manager.verify().isEmpty());

		writeMigration(file.getFileName().toString(), "CREATE TABLE users (id INTEGER, name TEXT);", "DROP TABLE users;");
		assertEquals(1, manager.verify().size());
	}

	@Test
	void seedHelpers() throws IOException {
		writeMigration("20240101000000_add_users.sql",
				"CREATE TABLE users (id INTEGER PRIMARY KEY AUTOINCREMENT, name TEXT NOT NULL);", "DROP TABLE users;");
		manager.upAll();

		manager.seed(ctx -> {
			var alice = ctx.insert("users", Map.of("name", "alice"));
			assertEquals("alice", alice.get("name"));
			assertEquals(1L, Utils.numberToLong(alice.get("id")));
			ctx.insertMany("users", List.of(Map.of("name", "bob"), Map.of("name", "carol")));
			ctx.log("inserted users");
		});
		assertEquals(3, db.query("SELECT * FROM users").rowCount());

		manager.seed(ctx -> ctx.truncate("users"));
		assertEquals(0, db.query("SELECT * FROM users").rowCount());
	}
}
