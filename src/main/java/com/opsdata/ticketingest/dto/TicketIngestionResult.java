package com.opsdata.ticketingest.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(description = "Summary of one ingestion batch")
public record TicketIngestionResult(
        UUID sessionId,
        int inserted,
        int updated,
        int failed,
        List<IngestionError> errors
) {
    public int processed() {
        return inserted + updated + failed;
    }
}
