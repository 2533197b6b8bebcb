package it.cavallium.sqlkeeper.core.common.cdc;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

public record CdcSubscription(String id,
                              String table,
                              CdcEventType event,
                              @Nullable String filter,
                              Instant createdAt,
                              boolean active) {}
