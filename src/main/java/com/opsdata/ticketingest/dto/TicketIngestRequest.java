package com.opsdata.ticketingest.dto;

import com.opsdata.ticketingest.model.IngestionMode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Schema(description = "Ticket rows submitted directly as JSON")
public class TicketIngestRequest {

    @Schema(description = "Ticket source the rows were exported from", requiredMode = Schema.RequiredMode.REQUIRED)
    private UUID sourceId;

    @Schema(description = "Email of the user submitting the batch", requiredMode = Schema.RequiredMode.REQUIRED)
    private String requestedBy;

    @Schema(description = "Label stored as the session's file name")
    private String label;

    @Schema(description = "MERGE (default) or INSERT_ONLY")
    private IngestionMode mode;

    @Schema(description = "Rows keyed by uploaded_tickets column name")
    private List<Map<String, String>> records;
}
