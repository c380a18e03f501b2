package com.opsdata.ticketingest.controller;

import com.opsdata.ticketingest.dto.MetricsRecalculationResult;
import com.opsdata.ticketingest.dto.S3IngestRequest;
import com.opsdata.ticketingest.dto.TicketIngestRequest;
import com.opsdata.ticketingest.dto.TicketIngestionResult;
import com.opsdata.ticketingest.dto.UploadSessionResponse;
import com.opsdata.ticketingest.model.IngestionMode;
import com.opsdata.ticketingest.model.UploadSession;
import com.opsdata.ticketingest.service.TicketIngestionException;
import com.opsdata.ticketingest.service.TicketMetricsRecalculationService;
import com.opsdata.ticketingest.service.TicketUploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@RestController
@RequestMapping("/api/tickets")
@Tag(name = "Ticket Ingestion", description = "Upload ticket exports and run them through the ingestion pipeline")
public class TicketUploadController {

    private static final Logger logger = LoggerFactory.getLogger(TicketUploadController.class);

    private final TicketUploadService ticketUploadService;
    private final TicketMetricsRecalculationService recalculationService;

    public TicketUploadController(TicketUploadService ticketUploadService,
                                  TicketMetricsRecalculationService recalculationService) {
        this.ticketUploadService = ticketUploadService;
        this.recalculationService = recalculationService;
    }

    @Operation(
            summary = "Upload a CSV ticket export",
            description = "Parses the file, opens an upload session and processes the rows in the background. " +
                    "Poll /api/upload-sessions/{id} for progress."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Upload accepted, session created"),
            @ApiResponse(responseCode = "400", description = "Empty or non-CSV file, unknown source, missing requester"),
            @ApiResponse(responseCode = "422", description = "CSV could not be parsed or has no data rows"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(
            @Parameter(description = "CSV export file", required = true) @RequestParam("file") MultipartFile file,
            @Parameter(description = "Ticket source id", required = true) @RequestParam("sourceId") UUID sourceId,
            @Parameter(description = "Email of the uploading user", required = true) @RequestParam("requestedBy") String requestedBy,
            @Parameter(description = "MERGE (default) or INSERT_ONLY") @RequestParam(value = "mode", required = false) IngestionMode mode) {
        logger.info("Received ticket upload '{}' from {} for source {}", file.getOriginalFilename(), requestedBy, sourceId);
        try {
            UploadSession session = ticketUploadService.submitUpload(file, sourceId, requestedBy, mode);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(UploadSessionResponse.from(session));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (TicketIngestionException e) {
            return ResponseEntity.unprocessableEntity().body(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Ticket upload failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Upload failed: " + e.getMessage());
        }
    }

    @Operation(summary = "Ingest ticket rows sent as JSON", description = "Processes the batch synchronously and returns the summary.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch processed; see counts and errors"),
            @ApiResponse(responseCode = "400", description = "Unknown source or missing requester"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping("/ingest")
    public ResponseEntity<?> ingest(@RequestBody TicketIngestRequest request) {
        try {
            TicketIngestionResult result = ticketUploadService.ingestRecords(request);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Ticket batch failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Ingestion failed: " + e.getMessage());
        }
    }

    @Operation(summary = "Ingest a CSV ticket export stored in S3", description = "Downloads the object and processes it like an upload.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Import accepted, session created"),
            @ApiResponse(responseCode = "400", description = "Invalid S3 URI, unknown source, missing requester"),
            @ApiResponse(responseCode = "422", description = "Object missing or not a readable CSV"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping("/ingest-s3")
    public ResponseEntity<?> ingestFromS3(@RequestBody S3IngestRequest request) {
        logger.info("Received S3 ticket import {} from {}", request.getS3Uri(), request.getRequestedBy());
        try {
            UploadSession session = ticketUploadService.submitS3Import(
                    request.getS3Uri(), request.getSourceId(), request.getRequestedBy(), request.getMode());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(UploadSessionResponse.from(session));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (TicketIngestionException e) {
            return ResponseEntity.unprocessableEntity().body(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("S3 ticket import failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Import failed: " + e.getMessage());
        }
    }

    @Operation(summary = "Recompute MTTR/MTTI seconds and minutes from the stored duration strings")
    @PostMapping("/metrics/recalculate")
    public ResponseEntity<MetricsRecalculationResult> recalculateMetrics() {
        return ResponseEntity.ok(recalculationService.recalculateAll());
    }
}
