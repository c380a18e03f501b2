package com.opsdata.ticketingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Organization mapping: routes tickets of one source whose support organization equals
 * {@code sourceOrganizationValue} to an internal project.
 */
@Setter
@Getter
@Entity
@Table(name = "ticket_upload_mappings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"source_id", "project_id", "source_organization_value"}))
public class TicketUploadMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    // e.g. "Assigned_Support_Organization"
    @Column(name = "source_organization_field", nullable = false)
    private String sourceOrganizationField;

    @Column(name = "source_organization_value", nullable = false, length = 500)
    private String sourceOrganizationValue;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public TicketUploadMapping() {
    }

    public TicketUploadMapping(UUID sourceId, UUID projectId, String sourceOrganizationField, String sourceOrganizationValue) {
        this.sourceId = sourceId;
        this.projectId = projectId;
        this.sourceOrganizationField = sourceOrganizationField;
        this.sourceOrganizationValue = sourceOrganizationValue;
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
