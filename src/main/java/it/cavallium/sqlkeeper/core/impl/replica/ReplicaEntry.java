package it.cavallium.sqlkeeper.core.impl.replica;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.jetbrains.annotations.Nullable;

final class ReplicaEntry {

	final String name;
	final String connectionString;
	final @Nullable Path path;
	final DatabaseAdapter adapter;
	final AtomicLong queriesServed = new AtomicLong();
	volatile ReplicaStatus status = ReplicaStatus.ACTIVE;
	volatile long lagMs;
	volatile @Nullable Instant lastSyncAt;
	@Nullable ScheduledFuture<?> syncTask;

	ReplicaEntry(String name, String connectionString, @Nullable Path path, DatabaseAdapter adapter) {
		this.name = name;
		this.connectionString = connectionString;
		this.path = path;
		this.adapter = adapter;
	}

	ReplicaInfo toInfo() {
		return new ReplicaInfo(name, connectionString, status, lagMs, lastSyncAt, queriesServed.get());
	}
}
