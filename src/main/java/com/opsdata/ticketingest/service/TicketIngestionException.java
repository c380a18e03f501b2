package com.opsdata.ticketingest.service;

/**
 * A whole request could not be ingested: unreadable file, unknown source, missing S3 object.
 * Row-level problems never raise this.
 */
public class TicketIngestionException extends RuntimeException {

    public TicketIngestionException(String message) {
        super(message);
    }

    public TicketIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
