package com.opsdata.ticketingest.model;

/**
 * Machine-readable reason codes reported for rejected rows.
 */
public enum ValidationReason {
    MISSING_KEY("MissingKey"),
    DUPLICATE_KEY("DuplicateKey"),
    INVALID_ENUM("InvalidEnum"),
    INVALID_DATE("InvalidDate"),
    PERSISTENCE_ERROR("PersistenceError");

    private final String code;

    ValidationReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
