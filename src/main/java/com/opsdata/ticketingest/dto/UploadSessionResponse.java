package com.opsdata.ticketingest.dto;

import com.opsdata.ticketingest.model.UploadSession;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UploadSessionResponse(
        UUID id,
        String userEmail,
        UUID sourceId,
        String fileName,
        int totalRows,
        int processedRows,
        int insertedRows,
        int updatedRows,
        int failedRows,
        String status,
        String errorMessage,
        OffsetDateTime createdAt,
        OffsetDateTime completedAt
) {
    public static UploadSessionResponse from(UploadSession session) {
        return new UploadSessionResponse(
                session.getId(),
                session.getUserEmail(),
                session.getSourceId(),
                session.getFileName(),
                session.getTotalRows(),
                session.getProcessedRows(),
                session.getInsertedRows(),
                session.getUpdatedRows(),
                session.getFailedRows(),
                session.getStatus(),
                session.getErrorMessage(),
                session.getCreatedAt(),
                session.getCompletedAt());
    }
}
