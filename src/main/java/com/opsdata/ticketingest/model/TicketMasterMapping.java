package com.opsdata.ticketingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Source-wide assignee mapping, consulted when no organization-scoped user mapping matches.
 */
@Setter
@Getter
@Entity
@Table(name = "ticket_master_mappings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"source_id", "source_assignee_value"}))
public class TicketMasterMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @Column(name = "source_assignee_value", nullable = false, length = 500)
    private String sourceAssigneeValue;

    @Column(name = "mapped_user_email", nullable = false)
    private String mappedUserEmail;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public TicketMasterMapping() {
    }

    public TicketMasterMapping(UUID sourceId, String sourceAssigneeValue, String mappedUserEmail) {
        this.sourceId = sourceId;
        this.sourceAssigneeValue = sourceAssigneeValue;
        this.mappedUserEmail = mappedUserEmail;
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
