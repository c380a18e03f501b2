package com.opsdata.ticketingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Assignee mapping scoped to one organization mapping.
 */
@Setter
@Getter
@Entity
@Table(name = "ticket_upload_user_mappings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"mapping_id", "user_email", "source_assignee_value"}))
public class TicketUploadUserMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "mapping_id", nullable = false)
    private UUID mappingId;

    @Column(name = "user_email", nullable = false)
    private String userEmail;

    @Column(name = "source_assignee_field", nullable = false)
    private String sourceAssigneeField;

    @Column(name = "source_assignee_value", nullable = false, length = 500)
    private String sourceAssigneeValue;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public TicketUploadUserMapping() {
    }

    public TicketUploadUserMapping(UUID mappingId, String userEmail, String sourceAssigneeField, String sourceAssigneeValue) {
        this.mappingId = mappingId;
        this.userEmail = userEmail;
        this.sourceAssigneeField = sourceAssigneeField;
        this.sourceAssigneeValue = sourceAssigneeValue;
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
