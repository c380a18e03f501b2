package com.opsdata.ticketingest.model;

import java.util.UUID;

/**
 * Where a batch comes from and how it is merged. {@code sessionId} is null for batches that
 * report no progress.
 */
public record IngestionContext(UUID sourceId, IngestionMode mode, UUID sessionId) {

    public IngestionContext {
        if (mode == null) {
            mode = IngestionMode.MERGE;
        }
    }

    public static IngestionContext merge(UUID sourceId) {
        return new IngestionContext(sourceId, IngestionMode.MERGE, null);
    }
}
