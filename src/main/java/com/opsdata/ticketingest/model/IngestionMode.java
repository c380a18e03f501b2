package com.opsdata.ticketingest.model;

/**
 * How a batch treats business keys that already exist in storage.
 */
public enum IngestionMode {
    /** Existing tickets are overwritten by the incoming row. */
    MERGE,
    /** Existing tickets are rejected with {@code DuplicateKey}. */
    INSERT_ONLY
}
