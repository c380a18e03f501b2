package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.dto.IngestionError;
import com.opsdata.ticketingest.dto.TicketIngestionResult;
import com.opsdata.ticketingest.model.UploadSession;
import com.opsdata.ticketingest.model.UploadSessionStatus;
import com.opsdata.ticketingest.repository.UploadSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Lifecycle of an {@link UploadSession}: created as {@code processing}, advanced with
 * {@code processed_rows}, and closed as {@code completed} or {@code failed}.
 */
@Service
public class UploadSessionService {

    private static final Logger logger = LoggerFactory.getLogger(UploadSessionService.class);

    private final UploadSessionRepository uploadSessionRepository;
    private final int maxErrorLines;

    public UploadSessionService(UploadSessionRepository uploadSessionRepository,
                                @Value("${app.ingestion.max-error-lines:50}") int maxErrorLines) {
        this.uploadSessionRepository = uploadSessionRepository;
        this.maxErrorLines = maxErrorLines;
    }

    @Transactional
    public UploadSession start(String requestedBy, UUID sourceId, String fileName, int totalRows) {
        UploadSession session = new UploadSession();
        session.setUserEmail(requestedBy);
        session.setSourceId(sourceId);
        session.setFileName(fileName);
        session.setTotalRows(totalRows);
        session.setStatus(UploadSessionStatus.PROCESSING);
        UploadSession saved = uploadSessionRepository.save(session);
        logger.info("Upload session {} started by {} for '{}' ({} rows)", saved.getId(), requestedBy, fileName, totalRows);
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordProgress(UUID sessionId, int processedRows) {
        if (sessionId == null) {
            return;
        }
        uploadSessionRepository.updateProcessedRows(sessionId, processedRows);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<UploadSession> complete(UUID sessionId, TicketIngestionResult result) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return uploadSessionRepository.findById(sessionId).map(session -> {
            session.setProcessedRows(result.processed());
            session.setInsertedRows(result.inserted());
            session.setUpdatedRows(result.updated());
            session.setFailedRows(result.failed());
            session.setStatus(terminalStatus(result));
            session.setErrorMessage(summarizeErrors(result.errors()));
            session.setCompletedAt(OffsetDateTime.now());
            UploadSession saved = uploadSessionRepository.save(session);
            logger.info("Upload session {} {}: inserted={}, updated={}, failed={}",
                    sessionId, saved.getStatus(), result.inserted(), result.updated(), result.failed());
            return saved;
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(UUID sessionId, String message) {
        if (sessionId == null) {
            return;
        }
        uploadSessionRepository.findById(sessionId).ifPresent(session -> {
            session.setStatus(UploadSessionStatus.FAILED);
            session.setErrorMessage(message);
            session.setCompletedAt(OffsetDateTime.now());
            uploadSessionRepository.save(session);
            logger.warn("Upload session {} failed: {}", sessionId, message);
        });
    }

    @Transactional(readOnly = true)
    public Optional<UploadSession> find(UUID sessionId) {
        return uploadSessionRepository.findById(sessionId);
    }

    @Transactional(readOnly = true)
    public List<UploadSession> findByRequester(String requestedBy) {
        return uploadSessionRepository.findAllByUserEmailOrderByCreatedAtDesc(requestedBy);
    }

    static String terminalStatus(TicketIngestionResult result) {
        boolean anySucceeded = result.inserted() + result.updated() > 0;
        return anySucceeded || result.failed() == 0 ? UploadSessionStatus.COMPLETED : UploadSessionStatus.FAILED;
    }

    String summarizeErrors(List<IngestionError> errors) {
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        String lines = errors.stream()
                .limit(maxErrorLines)
                .map(IngestionError::toLogLine)
                .collect(Collectors.joining("\n"));
        if (errors.size() > maxErrorLines) {
            lines += "\n... and " + (errors.size() - maxErrorLines) + " more";
        }
        return lines;
    }
}
