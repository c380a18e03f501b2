package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.dto.IngestionError;
import com.opsdata.ticketingest.dto.TicketIngestionResult;
import com.opsdata.ticketingest.model.DurationMetrics;
import com.opsdata.ticketingest.model.IngestionContext;
import com.opsdata.ticketingest.model.IngestionMode;
import com.opsdata.ticketingest.model.MergeOutcome;
import com.opsdata.ticketingest.model.NormalizedTicketRecord;
import com.opsdata.ticketingest.model.ResolvedMapping;
import com.opsdata.ticketingest.model.UploadedTicket;
import com.opsdata.ticketingest.model.ValidationReason;
import com.opsdata.ticketingest.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs a batch of raw ticket rows through normalize, validate, resolve, derive and merge, in input
 * order. Every row is attempted; a rejected or failed row is recorded and the batch moves on.
 * Each merge commits on its own, so a batch can partially succeed.
 */
@Service
public class TicketBatchIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(TicketBatchIngestionService.class);

    private final TicketRecordValidator validator;
    private final MappingResolver mappingResolver;
    private final DerivedMetricsCalculator metricsCalculator;
    private final TicketRecordMapper recordMapper;
    private final TicketUpsertService upsertService;
    private final UploadSessionService uploadSessionService;
    private final int progressInterval;

    public TicketBatchIngestionService(TicketRecordValidator validator,
                                       MappingResolver mappingResolver,
                                       DerivedMetricsCalculator metricsCalculator,
                                       TicketRecordMapper recordMapper,
                                       TicketUpsertService upsertService,
                                       UploadSessionService uploadSessionService,
                                       @Value("${app.ingestion.progress-interval:25}") int progressInterval) {
        this.validator = validator;
        this.mappingResolver = mappingResolver;
        this.metricsCalculator = metricsCalculator;
        this.recordMapper = recordMapper;
        this.upsertService = upsertService;
        this.uploadSessionService = uploadSessionService;
        this.progressInterval = Math.max(1, progressInterval);
    }

    public TicketIngestionResult ingest(List<Map<String, String>> rawRecords, IngestionContext context) {
        List<Map<String, String>> records = rawRecords != null ? rawRecords : List.of();
        logger.info("Ingesting {} ticket rows (source={}, mode={}, session={})",
                records.size(), context.sourceId(), context.mode(), context.sessionId());

        int inserted = 0;
        int updated = 0;
        int failed = 0;
        List<IngestionError> errors = new ArrayList<>();

        int processed = 0;
        for (Map<String, String> raw : records) {
            NormalizedTicketRecord record = FieldNormalizer.normalizeRecord(raw);
            String incidentId = record.incidentId().orElse(null);

            try {
                ValidationResult validation = validator.validate(record, context.mode());
                if (!validation.ok()) {
                    failed++;
                    errors.add(new IngestionError(incidentId, validation.reason().getCode(), validation.message()));
                    logger.warn("Skipping ticket {}: {} ({})", incidentId, validation.reason().getCode(), validation.message());
                } else {
                    Optional<MergeOutcome> outcome = writeRecord(record, context);
                    if (outcome.isEmpty()) {
                        failed++;
                        String detail = "incident_id " + incidentId + " already exists";
                        errors.add(new IngestionError(incidentId, ValidationReason.DUPLICATE_KEY.getCode(), detail));
                        logger.warn("Skipping ticket {}: {} ({})", incidentId, ValidationReason.DUPLICATE_KEY.getCode(), detail);
                    } else if (outcome.get() == MergeOutcome.INSERTED) {
                        inserted++;
                    } else {
                        updated++;
                    }
                }
            } catch (RuntimeException e) {
                failed++;
                String detail = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
                errors.add(new IngestionError(incidentId, ValidationReason.PERSISTENCE_ERROR.getCode(), detail));
                logger.warn("Failed to ingest ticket {}: {}", incidentId, detail);
            }

            processed++;
            if (context.sessionId() != null && processed % progressInterval == 0) {
                reportProgress(context.sessionId(), processed);
            }
        }

        TicketIngestionResult result = new TicketIngestionResult(context.sessionId(), inserted, updated, failed, errors);
        closeSession(context.sessionId(), result);
        logger.info("Ingestion finished: inserted={}, updated={}, failed={}", inserted, updated, failed);
        return result;
    }

    /**
     * Empty when an insert-only write finds the key already stored.
     */
    private Optional<MergeOutcome> writeRecord(NormalizedTicketRecord record, IngestionContext context) {
        ResolvedMapping mapping = mappingResolver.resolve(context.sourceId(), record);
        DurationMetrics metrics = metricsCalculator.deriveMetrics(record);
        UploadedTicket ticket = recordMapper.toEntity(record, context.sourceId(), mapping, metrics);
        if (context.mode() == IngestionMode.INSERT_ONLY) {
            return upsertService.insertNew(ticket) ? Optional.of(MergeOutcome.INSERTED) : Optional.empty();
        }
        return Optional.of(upsertService.merge(ticket));
    }

    // Progress is advisory; the rows already committed stand either way.
    private void reportProgress(UUID sessionId, int processed) {
        try {
            uploadSessionService.recordProgress(sessionId, processed);
        } catch (RuntimeException e) {
            logger.warn("Could not record progress {} for upload session {}: {}",
                    processed, sessionId, NestedExceptionUtils.getMostSpecificCause(e).getMessage());
        }
    }

    private void closeSession(UUID sessionId, TicketIngestionResult result) {
        try {
            uploadSessionService.complete(sessionId, result);
        } catch (RuntimeException e) {
            logger.error("Could not close upload session {} after ingestion", sessionId, e);
        }
    }
}
