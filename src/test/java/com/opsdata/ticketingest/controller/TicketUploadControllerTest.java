package com.opsdata.ticketingest.controller;

import com.opsdata.ticketingest.dto.IngestionError;
import com.opsdata.ticketingest.dto.TicketIngestRequest;
import com.opsdata.ticketingest.dto.TicketIngestionResult;
import com.opsdata.ticketingest.model.IngestionMode;
import com.opsdata.ticketingest.model.UploadSession;
import com.opsdata.ticketingest.service.TicketIngestionException;
import com.opsdata.ticketingest.service.TicketMetricsRecalculationService;
import com.opsdata.ticketingest.service.TicketUploadService;
import com.opsdata.ticketingest.service.UploadSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TicketUploadControllerTest {

    private static final UUID SOURCE = UUID.fromString("7b0c3c1e-5a43-4f4e-9d38-2f7f6f7d1a01");

    @Mock
    private TicketUploadService ticketUploadService;

    @Mock
    private TicketMetricsRecalculationService recalculationService;

    @Mock
    private UploadSessionService uploadSessionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                new TicketUploadController(ticketUploadService, recalculationService),
                new UploadSessionController(uploadSessionService)).build();
    }

    @Test
    void uploadAnswersAcceptedWithSession() throws Exception {
        UploadSession session = session();
        when(ticketUploadService.submitUpload(any(), eq(SOURCE), eq("ops@example.com"), eq(IngestionMode.MERGE)))
                .thenReturn(session);

        mockMvc.perform(multipart("/api/tickets/upload")
                        .file(new MockMultipartFile("file", "t.csv", "text/csv", "incident_id\nINC1\n".getBytes()))
                        .param("sourceId", SOURCE.toString())
                        .param("requestedBy", "ops@example.com")
                        .param("mode", "MERGE"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(session.getId().toString()))
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.totalRows").value(1));
    }

    @Test
    void uploadValidationErrorIsBadRequest() throws Exception {
        when(ticketUploadService.submitUpload(any(), eq(SOURCE), eq("ops@example.com"), any()))
                .thenThrow(new IllegalArgumentException("Only .csv ticket exports are supported: t.xlsx"));

        mockMvc.perform(multipart("/api/tickets/upload")
                        .file(new MockMultipartFile("file", "t.xlsx", "application/octet-stream", new byte[]{1}))
                        .param("sourceId", SOURCE.toString())
                        .param("requestedBy", "ops@example.com"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Only .csv ticket exports are supported: t.xlsx"));
    }

    @Test
    void unreadableCsvIsUnprocessable() throws Exception {
        when(ticketUploadService.submitUpload(any(), eq(SOURCE), eq("ops@example.com"), any()))
                .thenThrow(new TicketIngestionException("CSV file must contain a header and at least one data row"));

        mockMvc.perform(multipart("/api/tickets/upload")
                        .file(new MockMultipartFile("file", "t.csv", "text/csv", "incident_id\n".getBytes()))
                        .param("sourceId", SOURCE.toString())
                        .param("requestedBy", "ops@example.com"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void jsonIngestReturnsSummaryWithErrors() throws Exception {
        when(ticketUploadService.ingestRecords(any(TicketIngestRequest.class))).thenReturn(new TicketIngestionResult(
                null, 1, 0, 1, List.of(new IngestionError("INC2", "InvalidEnum", "priority 'BOGUS' is not allowed"))));

        mockMvc.perform(post("/api/tickets/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceId\":\"" + SOURCE + "\",\"requestedBy\":\"ops@example.com\","
                                + "\"records\":[{\"incident_id\":\"INC1\"},{\"incident_id\":\"INC2\",\"priority\":\"BOGUS\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inserted").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.errors[0].incident_id").value("INC2"))
                .andExpect(jsonPath("$.errors[0].reason").value("InvalidEnum"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(uploadSessionService.find(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/upload-sessions/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void listsSessionsForRequester() throws Exception {
        when(uploadSessionService.findByRequester("ops@example.com")).thenReturn(List.of(session()));

        mockMvc.perform(get("/api/upload-sessions").param("requestedBy", "ops@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].fileName").value("t.csv"));
    }

    private static UploadSession session() {
        UploadSession session = new UploadSession();
        session.setId(UUID.randomUUID());
        session.setUserEmail("ops@example.com");
        session.setSourceId(SOURCE);
        session.setFileName("t.csv");
        session.setTotalRows(1);
        return session;
    }
}
