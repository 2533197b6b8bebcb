package it.cavallium.sqlkeeper.core.common.cdc;

import java.time.Instant;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A row change detected by comparing two table snapshots.
 * {@code oldRow} is null for inserts, {@code newRow} is null for deletes.
 */
public record CdcChange(CdcEventType type,
                        String table,
                        @Nullable Map<String, Object> oldRow,
                        @Nullable Map<String, Object> newRow,
                        Instant timestamp,
                        String schema) {

    public static final String DEFAULT_SCHEMA = "public";

    /**
     * @return the row that filters are evaluated against
     */
    public Map<String, Object> targetRow() {
        return newRow != null ? newRow : oldRow;
    }
}
