package it.cavallium.sqlkeeper.core.impl.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import it.cavallium.sqlkeeper.core.client.JdbcDatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.DatabaseInfo;
import it.cavallium.sqlkeeper.core.common.QueryResult;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.impl.replica.ReplicaInfo;
import it.cavallium.sqlkeeper.core.impl.replica.ReplicaManager;
import it.cavallium.sqlkeeper.core.impl.replica.ReplicaSettings;
import it.cavallium.sqlkeeper.core.impl.replica.ReplicaStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReplicaManagerTest {

	private static ReplicaInfo find(ReplicaManager manager, String name) {
		for (ReplicaInfo info : manager.listReplicas()) {
			if (info.name().equals(name)) {
				return info;
			}
		}
		throw new AssertionError("Replica not listed: " + name);
	}

	@Nested
	class Embedded {

		@TempDir
		Path dir;

		private DatabaseAdapter primary;
		private ReplicaManager replicas;

		@BeforeEach
		void setUp() {
			primary = JdbcDatabaseAdapter.sqlite(dir.resolve("primary.db"));
			primary.execute("CREATE TABLE items (id INTEGER PRIMARY KEY, name TEXT)");
			primary.execute("INSERT INTO items (name) VALUES ('a')");
			replicas = new ReplicaManager(primary,
					ReplicaSettings.of(dir.resolve("replicas")).withSyncInterval(Duration.ofHours(1)));
		}

		@AfterEach
		void tearDown() {
			replicas.close();
			primary.close();
		}

		private int itemCount(DatabaseAdapter adapter) {
			return adapter.query("SELECT * FROM items").rowCount();
		}

		@Test
		void addReplicaCopiesThePrimary() {
			replicas.addReplica("r1", "");
			assertTrue(Files.exists(dir.resolve("replicas").resolve("r1.db")));

			var info = find(replicas, "r1");
			assertEquals(ReplicaStatus.ACTIVE, info.status());
			assertNotNull(info.lastSyncAt());

			var reads = replicas.getReadAdapter();
			assertEquals(1, itemCount(reads));
			assertEquals(1, find(replicas, "r1").queriesServed());
		}

		@Test
		void replicasServeStaleDataUntilSynced() {
			replicas.addReplica("r1", dir.resolve("custom.db").toString());
			primary.execute("INSERT INTO items (name) VALUES ('b')");

			var reads = replicas.getReadAdapter();
			assertEquals(1, itemCount(reads));
			assertEquals(2, itemCount(replicas.getWriteAdapter()));

			replicas.syncNow("r1");
			assertEquals(2, itemCount(reads));
		}

		@Test
		void writesGoToThePrimary() {
			replicas.addReplica("r1", "");
			var reads = replicas.getReadAdapter();
			reads.execute("INSERT INTO items (name) VALUES ('c')");
			assertSame(primary, replicas.getWriteAdapter());
			assertEquals(2, itemCount(primary));
			assertEquals(1, itemCount(reads));
		}

		@Test
		void duplicateAndUnknownNames() {
			replicas.addReplica("r1", "");
			var ex = assertThrows(SqlKeeperException.class, () -> replicas.addReplica("r1", ""));
			assertEquals(SqlKeeperErrorType.REPLICA_EXISTS, ex.getErrorUniqueId());

			ex = assertThrows(SqlKeeperException.class, () -> replicas.removeReplica("missing"));
			assertEquals(SqlKeeperErrorType.REPLICA_NOT_FOUND, ex.getErrorUniqueId());
			ex = assertThrows(SqlKeeperException.class, () -> replicas.promoteReplica("missing"));
			assertEquals(SqlKeeperErrorType.REPLICA_NOT_FOUND, ex.getErrorUniqueId());
		}

		@Test
		void removeReplicaDeletesItsFile() {
			replicas.addReplica("r1", "");
			var file = dir.resolve("replicas").resolve("r1.db");
			replicas.removeReplica("r1");
			assertFalse(Files.exists(file));
			assertFalse(Files.exists(dir.resolve("replicas").resolve("r1.db-wal")));
			assertFalse(Files.exists(dir.resolve("replicas").resolve("r1.db-shm")));
			assertTrue(replicas.listReplicas().isEmpty());
			// reads fall back to the primary
			assertEquals(1, itemCount(replicas.getReadAdapter()));
		}

		@Test
		void promoteReplaceThePrimaryWithTheReplica() {
			replicas.addReplica("r1", "");
			replicas.addReplica("r2", "");
			primary.execute("INSERT INTO items (name) VALUES ('after copy')");
			assertEquals(2, itemCount(primary));

			replicas.promoteReplica("r1");
			assertEquals(1, itemCount(primary));
			assertEquals(ReplicaStatus.ACTIVE, find(replicas, "r1").status());
			assertEquals(ReplicaStatus.INACTIVE, find(replicas, "r2").status());
		}

		@Test
		void promoteWithMissingFile() throws Exception {
			var path = dir.resolve("gone.db");
			replicas.addReplica("r1", path.toString());
			Files.delete(path);
			var ex = assertThrows(SqlKeeperException.class, () -> replicas.promoteReplica("r1"));
			assertEquals(SqlKeeperErrorType.REPLICA_FILE_MISSING, ex.getErrorUniqueId());
		}

		@Test
		void healthCheckAndLag() {
			replicas.addReplica("r1", "");
			replicas.addReplica("r2", "");
			var results = replicas.healthCheck();
			assertEquals(2, results.size());
			assertTrue(results.get(0).healthy());
			assertTrue(results.get(1).healthy());
			assertTrue(replicas.getReplicaLag() >= 0);
			assertTrue(replicas.getReplicaLag("r2") >= 0);
		}
	}

	@Nested
	class Server {

		private DatabaseAdapter primary;
		private DatabaseAdapter first;
		private DatabaseAdapter second;
		private ReplicaManager replicas;

		@BeforeEach
		void setUp() {
			primary = mock(DatabaseAdapter.class);
			first = mock(DatabaseAdapter.class);
			second = mock(DatabaseAdapter.class);
			when(primary.getInfo()).thenReturn(DatabaseInfo.remote("postgres://primary/app"));
			when(primary.query(anyString(), anyList())).thenReturn(new QueryResult(List.of(Map.of("from", "primary"))));
			when(first.query(anyString(), anyList())).thenReturn(new QueryResult(List.of(Map.of("from", "first"))));
			when(second.query(anyString(), anyList())).thenReturn(new QueryResult(List.of(Map.of("from", "second"))));
			var adapters = Map.of("postgres://first/app", first, "postgres://second/app", second);
			replicas = new ReplicaManager(primary, ReplicaSettings.defaults().withServerAdapterFactory(adapters::get));
		}

		@AfterEach
		void tearDown() {
			replicas.close();
		}

		private Object readFrom(DatabaseAdapter reads) {
			return reads.query("SELECT 1").rows().get(0).get("from");
		}

		@Test
		void factoryIsRequired() {
			try (var withoutFactory = new ReplicaManager(primary, ReplicaSettings.defaults())) {
				var ex = assertThrows(SqlKeeperException.class,
						() -> withoutFactory.addReplica("r1", "postgres://first/app"));
				assertEquals(SqlKeeperErrorType.REPLICA_ADAPTER_FACTORY_MISSING, ex.getErrorUniqueId());
			}
		}

		@Test
		void readsRotateOverReplicas() {
			replicas.addReplica("r1", "postgres://first/app");
			replicas.addReplica("r2", "postgres://second/app");
			var reads = replicas.getReadAdapter();
			assertEquals(List.of("first", "second", "first", "second"),
					List.of(readFrom(reads), readFrom(reads), readFrom(reads), readFrom(reads)));
			assertEquals(2, find(replicas, "r1").queriesServed());
			assertEquals(2, find(replicas, "r2").queriesServed());
			verify(primary, never()).query(anyString(), anyList());
		}

		@Test
		void failingReplicaFallsBackToPrimary() {
			when(first.query(anyString(), anyList())).thenThrow(SqlKeeperException.of(SqlKeeperErrorType.QUERY_FAILED, "down"));
			replicas.addReplica("r1", "postgres://first/app");
			var reads = replicas.getReadAdapter();

			assertEquals("primary", readFrom(reads));
			assertEquals(ReplicaStatus.ERROR, find(replicas, "r1").status());
			// replicas in error are skipped
			assertEquals("primary", readFrom(reads));
			verify(first).query(anyString(), anyList());
		}

		@Test
		void writesNeverReachReplicas() {
			replicas.addReplica("r1", "postgres://first/app");
			var reads = replicas.getReadAdapter();
			reads.query("UPDATE items SET name = 'x' RETURNING *");
			verify(primary).query(anyString(), anyList());
			verify(first, never()).query(anyString(), anyList());
		}

		@Test
		void promotionOnlyChangesStatuses() {
			replicas.addReplica("r1", "postgres://first/app");
			replicas.addReplica("r2", "postgres://second/app");
			replicas.promoteReplica("r2");
			assertEquals(ReplicaStatus.INACTIVE, find(replicas, "r1").status());
			assertEquals(ReplicaStatus.ACTIVE, find(replicas, "r2").status());
			assertEquals(List.of("second", "second"), List.of(readFrom(replicas.getReadAdapter()),
					readFrom(replicas.getReadAdapter())));
		}
	}
}
