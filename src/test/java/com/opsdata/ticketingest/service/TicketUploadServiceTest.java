package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.dto.TicketIngestRequest;
import com.opsdata.ticketingest.dto.TicketIngestionResult;
import com.opsdata.ticketingest.model.IngestionContext;
import com.opsdata.ticketingest.model.IngestionMode;
import com.opsdata.ticketingest.model.UploadSession;
import com.opsdata.ticketingest.repository.TicketSourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TicketUploadServiceTest {

    private static final UUID SOURCE = UUID.randomUUID();
    private static final String CSV = "Incident ID,Priority\nINC1,INC\nINC2,SR\n";

    @Mock
    private TicketSourceRepository ticketSourceRepository;

    @Mock
    private UploadSessionService uploadSessionService;

    @Mock
    private TicketBatchIngestionService batchIngestionService;

    @Mock
    private S3StorageService s3StorageService;

    private final UUID sessionId = UUID.randomUUID();

    private TicketUploadService service;

    @BeforeEach
    void setUp() {
        // runs background work inline
        TaskExecutor inline = Runnable::run;
        service = new TicketUploadService(ticketSourceRepository, new TicketCsvReader(), uploadSessionService,
                batchIngestionService, s3StorageService, inline, 1024);

        lenient().when(ticketSourceRepository.existsById(SOURCE)).thenReturn(true);
        lenient().when(uploadSessionService.start(anyString(), any(), anyString(), anyInt())).thenAnswer(invocation -> {
            UploadSession session = new UploadSession();
            session.setId(sessionId);
            session.setUserEmail(invocation.getArgument(0));
            session.setSourceId(invocation.getArgument(1));
            session.setFileName(invocation.getArgument(2));
            session.setTotalRows(invocation.getArgument(3));
            return session;
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void csvUploadOpensSessionAndRunsBatch() {
        MockMultipartFile file = csvFile("tickets.csv", CSV);

        UploadSession session = service.submitUpload(file, SOURCE, "ops@example.com", IngestionMode.INSERT_ONLY);

        assertThat(session.getId()).isEqualTo(sessionId);
        assertThat(session.getTotalRows()).isEqualTo(2);
        assertThat(session.getFileName()).isEqualTo("tickets.csv");

        ArgumentCaptor<List<Map<String, String>>> rows = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<IngestionContext> context = ArgumentCaptor.forClass(IngestionContext.class);
        verify(batchIngestionService).ingest(rows.capture(), context.capture());
        assertThat(rows.getValue()).extracting(r -> r.get("incident_id")).containsExactly("INC1", "INC2");
        assertThat(context.getValue()).isEqualTo(new IngestionContext(SOURCE, IngestionMode.INSERT_ONLY, sessionId));
    }

    @Test
    void rejectsNonCsvFiles() {
        assertThatThrownBy(() -> service.submitUpload(csvFile("tickets.xlsx", CSV), SOURCE, "ops@example.com", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(".csv");
        verify(uploadSessionService, never()).start(anyString(), any(), anyString(), anyInt());
    }

    @Test
    void rejectsOversizedFiles() {
        String big = "incident_id\n" + "INC1\n".repeat(300);

        assertThatThrownBy(() -> service.submitUpload(csvFile("big.csv", big), SOURCE, "ops@example.com", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnknownSourceBeforeCreatingSession() {
        UUID unknown = UUID.randomUUID();
        when(ticketSourceRepository.existsById(unknown)).thenReturn(false);

        assertThatThrownBy(() -> service.submitUpload(csvFile("t.csv", CSV), unknown, "ops@example.com", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown ticket source");
        verify(uploadSessionService, never()).start(anyString(), any(), anyString(), anyInt());
    }

    @Test
    void requiresRequester() {
        assertThatThrownBy(() -> service.submitUpload(csvFile("t.csv", CSV), SOURCE, " ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void headerOnlyCsvIsRejected() {
        assertThatThrownBy(() -> service.submitUpload(csvFile("t.csv", "incident_id,priority\n"), SOURCE, "ops@example.com", null))
                .isInstanceOf(TicketIngestionException.class);
    }

    @Test
    void backgroundFailureMarksSessionFailed() {
        when(batchIngestionService.ingest(anyList(), any(IngestionContext.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        UploadSession session = service.submitUpload(csvFile("t.csv", CSV), SOURCE, "ops@example.com", null);

        assertThat(session.getId()).isEqualTo(sessionId);
        verify(uploadSessionService).fail(eq(sessionId), contains("connection refused"));
    }

    @Test
    void jsonBatchRunsSynchronously() {
        TicketIngestionResult expected = new TicketIngestionResult(sessionId, 1, 0, 0, List.of());
        when(batchIngestionService.ingest(anyList(), any(IngestionContext.class))).thenReturn(expected);
        TicketIngestRequest request = new TicketIngestRequest();
        request.setSourceId(SOURCE);
        request.setRequestedBy("ops@example.com");
        request.setRecords(List.of(Map.of("incident_id", "INC1")));

        TicketIngestionResult result = service.ingestRecords(request);

        assertThat(result).isSameAs(expected);
        verify(uploadSessionService).start("ops@example.com", SOURCE, "api-batch", 1);
    }

    @Test
    void s3ImportDownloadsAndRunsBatch() {
        S3StorageService.S3ObjectLocation location = new S3StorageService.S3ObjectLocation("exports", "aug.csv");
        when(s3StorageService.parseS3Uri("s3://exports/aug.csv")).thenReturn(location);
        when(s3StorageService.download(location)).thenReturn(CSV.getBytes(StandardCharsets.UTF_8));

        UploadSession session = service.submitS3Import("s3://exports/aug.csv", SOURCE, "ops@example.com", null);

        assertThat(session.getFileName()).isEqualTo("s3://exports/aug.csv");
        verify(batchIngestionService).ingest(anyList(), eq(new IngestionContext(SOURCE, IngestionMode.MERGE, sessionId)));
    }

    private static MockMultipartFile csvFile(String name, String content) {
        return new MockMultipartFile("file", name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }
}
