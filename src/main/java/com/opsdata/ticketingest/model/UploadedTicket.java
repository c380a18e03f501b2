package com.opsdata.ticketingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Canonical ticket row, keyed by the source system's {@code incident_id}.
 *
 * Rows are written only through {@code UploadedTicketRepository#upsert}; the JPA mapping is used
 * for reads and for the derived-metric recalculation.
 */
@Setter
@Getter
@Entity
@Table(name = "uploaded_tickets")
public class UploadedTicket {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "source_id")
    private UUID sourceId;

    @Column(name = "mapping_id")
    private UUID mappingId;

    @Column(name = "project_id")
    private UUID projectId;

    @Column(name = "incident_id", nullable = false, unique = true)
    private String incidentId;

    @Column(name = "priority", length = 50)
    private String priority;

    @Column(name = "region")
    private String region;

    @Column(name = "assigned_support_organization", length = 500)
    private String assignedSupportOrganization;

    @Column(name = "assigned_group", length = 500)
    private String assignedGroup;

    @Column(name = "vertical")
    private String vertical;

    @Column(name = "sub_vertical")
    private String subVertical;

    @Column(name = "owner_support_organization", length = 500)
    private String ownerSupportOrganization;

    @Column(name = "owner_group", length = 500)
    private String ownerGroup;

    @Column(name = "owner")
    private String owner;

    @Column(name = "reported_source")
    private String reportedSource;

    @Column(name = "user_name")
    private String userName;

    @Column(name = "site_group")
    private String siteGroup;

    @Column(name = "operational_category_tier_1")
    private String operationalCategoryTier1;

    @Column(name = "operational_category_tier_2")
    private String operationalCategoryTier2;

    @Column(name = "operational_category_tier_3")
    private String operationalCategoryTier3;

    @Column(name = "product_name")
    private String productName;

    @Column(name = "product_categorization_tier_1")
    private String productCategorizationTier1;

    @Column(name = "product_categorization_tier_2")
    private String productCategorizationTier2;

    @Column(name = "product_categorization_tier_3")
    private String productCategorizationTier3;

    @Column(name = "incident_type")
    private String incidentType;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "assignee")
    private String assignee;

    @Column(name = "mapped_user_email")
    private String mappedUserEmail;

    @Column(name = "reported_date1")
    private OffsetDateTime reportedDate1;

    @Column(name = "responded_date")
    private OffsetDateTime respondedDate;

    @Column(name = "last_resolved_date")
    private OffsetDateTime lastResolvedDate;

    @Column(name = "closed_date")
    private OffsetDateTime closedDate;

    @Column(name = "status", length = 100)
    private String status;

    @Column(name = "status_reason_hidden", columnDefinition = "TEXT")
    private String statusReasonHidden;

    @Column(name = "pending_reason", columnDefinition = "TEXT")
    private String pendingReason;

    @Column(name = "group_transfers")
    private Integer groupTransfers;

    @Column(name = "total_transfers")
    private Integer totalTransfers;

    @Column(name = "department")
    private String department;

    @Column(name = "vip")
    private Boolean vip;

    @Column(name = "company")
    private String company;

    @Column(name = "vendor_ticket_number")
    private String vendorTicketNumber;

    @Column(name = "reported_to_vendor")
    private Boolean reportedToVendor;

    @Column(name = "resolution", columnDefinition = "TEXT")
    private String resolution;

    @Column(name = "resolver_group", length = 500)
    private String resolverGroup;

    @Column(name = "reopen_count")
    private Integer reopenCount;

    @Column(name = "reopened_date")
    private OffsetDateTime reopenedDate;

    @Column(name = "service_desk_1st_assigned_date")
    private OffsetDateTime serviceDesk1stAssignedDate;

    @Column(name = "service_desk_1st_assigned_group", length = 500)
    private String serviceDesk1stAssignedGroup;

    @Column(name = "submitter")
    private String submitter;

    @Column(name = "owner_login_id")
    private String ownerLoginId;

    @Column(name = "impact", length = 100)
    private String impact;

    @Column(name = "submit_date")
    private OffsetDateTime submitDate;

    @Column(name = "report_date")
    private OffsetDateTime reportDate;

    @Column(name = "vil_function")
    private String vilFunction;

    @Column(name = "it_partner")
    private String itPartner;

    // Original duration strings as exported, e.g. "02:58:25".
    @Column(name = "mttr", length = 50)
    private String mttr;

    @Column(name = "mtti", length = 50)
    private String mtti;

    // Derived from mttr/mtti; absent when the string does not parse.
    @Column(name = "mttr_seconds")
    private Integer mttrSeconds;

    @Column(name = "mtti_seconds")
    private Integer mttiSeconds;

    @Column(name = "mttr_minutes", precision = 10, scale = 2)
    private BigDecimal mttrMinutes;

    @Column(name = "mtti_minutes", precision = 10, scale = 2)
    private BigDecimal mttiMinutes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public UploadedTicket() {
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
