package com.opsdata.ticketingest.model;

/**
 * Status values stored in {@code upload_sessions.status}.
 */
public final class UploadSessionStatus {

    private UploadSessionStatus() {
    }

    public static final String PROCESSING = "processing";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

}
