package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.dto.TicketIngestRequest;
import com.opsdata.ticketingest.dto.TicketIngestionResult;
import com.opsdata.ticketingest.model.IngestionContext;
import com.opsdata.ticketingest.model.IngestionMode;
import com.opsdata.ticketingest.model.UploadSession;
import com.opsdata.ticketingest.repository.TicketSourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for every way tickets arrive: multipart CSV uploads and S3 exports are parsed and
 * processed in the background, JSON batches are processed on the caller's thread. Each run is
 * tracked by an {@link UploadSession}.
 */
@Service
public class TicketUploadService {

    private static final Logger logger = LoggerFactory.getLogger(TicketUploadService.class);

    private static final String CSV_EXTENSION = ".csv";
    private static final String API_BATCH_LABEL = "api-batch";

    private final TicketSourceRepository ticketSourceRepository;
    private final TicketCsvReader csvReader;
    private final UploadSessionService uploadSessionService;
    private final TicketBatchIngestionService batchIngestionService;
    private final S3StorageService s3StorageService;
    private final TaskExecutor uploadExecutor;
    private final long maxFileSizeBytes;

    public TicketUploadService(TicketSourceRepository ticketSourceRepository,
                               TicketCsvReader csvReader,
                               UploadSessionService uploadSessionService,
                               TicketBatchIngestionService batchIngestionService,
                               S3StorageService s3StorageService,
                               @Qualifier("ticketUploadExecutor") TaskExecutor uploadExecutor,
                               @Value("${app.upload.max-file-size-bytes:10485760}") long maxFileSizeBytes) {
        this.ticketSourceRepository = ticketSourceRepository;
        this.csvReader = csvReader;
        this.uploadSessionService = uploadSessionService;
        this.batchIngestionService = batchIngestionService;
        this.s3StorageService = s3StorageService;
        this.uploadExecutor = uploadExecutor;
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public UploadSession submitUpload(MultipartFile file, UUID sourceId, String requestedBy, IngestionMode mode) {
        requireRequester(requestedBy);
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.csv";
        requireCsv(fileName);
        if (file.getSize() > maxFileSizeBytes) {
            throw new IllegalArgumentException("File size must be at most " + maxFileSizeBytes + " bytes");
        }
        requireKnownSource(sourceId);

        List<Map<String, String>> rows;
        try (InputStream input = file.getInputStream()) {
            rows = readRows(input);
        } catch (IOException e) {
            throw new TicketIngestionException("Unable to read uploaded file " + fileName, e);
        }
        return startInBackground(rows, sourceId, requestedBy, fileName, mode);
    }

    public UploadSession submitS3Import(String s3Uri, UUID sourceId, String requestedBy, IngestionMode mode) {
        requireRequester(requestedBy);
        S3StorageService.S3ObjectLocation location = s3StorageService.parseS3Uri(s3Uri);
        requireCsv(location.key());
        requireKnownSource(sourceId);

        byte[] content = s3StorageService.download(location);
        List<Map<String, String>> rows = readRows(new ByteArrayInputStream(content));
        return startInBackground(rows, sourceId, requestedBy, s3Uri, mode);
    }

    public TicketIngestionResult ingestRecords(TicketIngestRequest request) {
        requireRequester(request.getRequestedBy());
        requireKnownSource(request.getSourceId());
        List<Map<String, String>> records = request.getRecords() != null ? request.getRecords() : List.of();
        String label = request.getLabel() != null && !request.getLabel().isBlank() ? request.getLabel() : API_BATCH_LABEL;

        UploadSession session = uploadSessionService.start(
                request.getRequestedBy(), request.getSourceId(), label, records.size());
        return runBatch(records, new IngestionContext(request.getSourceId(), request.getMode(), session.getId()));
    }

    private UploadSession startInBackground(List<Map<String, String>> rows,
                                            UUID sourceId,
                                            String requestedBy,
                                            String fileName,
                                            IngestionMode mode) {
        UploadSession session = uploadSessionService.start(requestedBy, sourceId, fileName, rows.size());
        IngestionContext context = new IngestionContext(sourceId, mode, session.getId());
        uploadExecutor.execute(() -> {
            try {
                batchIngestionService.ingest(rows, context);
            } catch (RuntimeException e) {
                abort(context, e);
            }
        });
        return session;
    }

    private TicketIngestionResult runBatch(List<Map<String, String>> rows, IngestionContext context) {
        try {
            return batchIngestionService.ingest(rows, context);
        } catch (RuntimeException e) {
            abort(context, e);
            throw e;
        }
    }

    private void abort(IngestionContext context, RuntimeException e) {
        logger.error("Ticket batch for session {} aborted", context.sessionId(), e);
        uploadSessionService.fail(context.sessionId(), "Processing failed: " + e.getMessage());
    }

    private List<Map<String, String>> readRows(InputStream input) {
        List<Map<String, String>> rows = csvReader.read(input);
        if (rows.isEmpty()) {
            throw new TicketIngestionException("CSV file must contain a header and at least one data row");
        }
        return rows;
    }

    private void requireKnownSource(UUID sourceId) {
        if (sourceId == null) {
            throw new IllegalArgumentException("sourceId is required");
        }
        if (!ticketSourceRepository.existsById(sourceId)) {
            throw new IllegalArgumentException("Unknown ticket source: " + sourceId);
        }
    }

    private static void requireRequester(String requestedBy) {
        if (requestedBy == null || requestedBy.isBlank()) {
            throw new IllegalArgumentException("requestedBy is required");
        }
    }

    private static void requireCsv(String name) {
        if (!name.toLowerCase(Locale.ROOT).endsWith(CSV_EXTENSION)) {
            throw new IllegalArgumentException("Only .csv ticket exports are supported: " + name);
        }
    }
}
