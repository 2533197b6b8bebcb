package it.cavallium.sqlkeeper.core.impl.replica;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * Point-in-time view of a replica
 * @param lagMs last measured lag, {@code -1} when the last measurement failed
 */
public record ReplicaInfo(String name,
		String connectionString,
		ReplicaStatus status,
		long lagMs,
		@Nullable Instant lastSyncAt,
		long queriesServed) {}
