package com.opsdata.ticketingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One batch run over a ticket export. {@code processedRows} and {@code status} are the only
 * progress signal callers get for long-running uploads.
 */
@Setter
@Getter
@Entity
@Table(name = "upload_sessions")
public class UploadSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    // Caller identity, passed in explicitly by the upload handler.
    @Column(name = "user_email", nullable = false)
    private String userEmail;

    @Column(name = "source_id")
    private UUID sourceId;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "total_rows", nullable = false)
    private int totalRows;

    @Column(name = "processed_rows", nullable = false)
    private int processedRows;

    @Column(name = "inserted_rows", nullable = false)
    private int insertedRows;

    @Column(name = "updated_rows", nullable = false)
    private int updatedRows;

    @Column(name = "failed_rows", nullable = false)
    private int failedRows;

    @Column(name = "status", nullable = false, length = 50)
    private String status = UploadSessionStatus.PROCESSING;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public UploadSession() {
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
