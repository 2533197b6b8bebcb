package it.cavallium.sqlkeeper.core.impl.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.cavallium.sqlkeeper.core.client.JdbcDatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.impl.migration.MigrationManager;
import it.cavallium.sqlkeeper.core.impl.migration.MigrationRegistry;
import it.cavallium.sqlkeeper.core.impl.migration.MigrationSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrationLockTest {

	@TempDir
	Path dir;

	private DatabaseAdapter db;
	private MutableClock firstClock;
	private MutableClock secondClock;
	private MigrationManager first;
	private MigrationManager second;

	@BeforeEach
	void setUp() {
		db = JdbcDatabaseAdapter.sqlite(dir.resolve("app.db"));
		var settings = MigrationSettings.of(dir.resolve("migrations"));
		firstClock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
		secondClock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
		first = new MigrationManager(db, settings, new MigrationRegistry(), firstClock);
		second = new MigrationManager(db, settings, new MigrationRegistry(), secondClock);
	}

	@AfterEach
	void tearDown() {
		db.close();
	}

	@Test
	void lockIsExclusive() {
		assertTrue(first.lock());
		assertFalse(second.lock());
		assertFalse(first.lock());

		first.unlock();
		assertTrue(second.lock());
		second.unlock();
	}

	@Test
	void concurrentLockHasOneWinner() throws Exception {
		var settings = MigrationSettings.of(dir.resolve("migrations"));
		var otherDb = JdbcDatabaseAdapter.sqlite(dir.resolve("app.db"));
		var executor = Executors.newFixedThreadPool(2);
		try {
			var clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
			var contenders = List.of(
					new MigrationManager(db, settings, new MigrationRegistry(), clock),
					new MigrationManager(otherDb, settings, new MigrationRegistry(), clock));
			// create the lock row before racing
			for (MigrationManager contender : contenders) {
				contender.unlock();
			}
			for (int round = 0; round < 20; round++) {
				var start = new CountDownLatch(1);
				var results = new ArrayList<Future<Boolean>>();
				for (MigrationManager contender : contenders) {
					results.add(executor.submit(() -> {
						start.await();
						return contender.lock();
					}));
				}
				start.countDown();
				int winners = 0;
				for (Future<Boolean> result : results) {
					if (result.get(30, TimeUnit.SECONDS)) {
						winners++;
					}
				}
				assertEquals(1, winners, "round " + round);
				contenders.get(0).unlock();
			}
		} finally {
			executor.shutdownNow();
			otherDb.close();
		}
	}

	@Test
	void staleLockIsTakenOver() {
		assertTrue(first.lock());

		secondClock.advance(Duration.ofMinutes(5));
		assertFalse(second.lock());

		secondClock.advance(Duration.ofMinutes(6));
		assertTrue(second.lock());
		assertFalse(first.lock());
	}
}
