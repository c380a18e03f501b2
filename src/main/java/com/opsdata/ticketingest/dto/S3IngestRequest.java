package com.opsdata.ticketingest.dto;

import com.opsdata.ticketingest.model.IngestionMode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.UUID;

@Data
@Schema(description = "CSV ticket export stored in S3")
public class S3IngestRequest {

    @Schema(description = "s3://bucket/key, or s3:///key for the default bucket", example = "s3://ticket-exports/remedy/2025-08-18.csv")
    private String s3Uri;

    private UUID sourceId;

    private String requestedBy;

    private IngestionMode mode;
}
