package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.dto.AverageDurations;
import com.opsdata.ticketingest.dto.MttrMttiProjectStats;
import com.opsdata.ticketingest.dto.MttrMttiTrendPoint;
import com.opsdata.ticketingest.dto.MttrMttiUserStats;
import com.opsdata.ticketingest.dto.UpsertStatistics;
import com.opsdata.ticketingest.model.MergeOutcome;
import com.opsdata.ticketingest.model.UploadedTicket;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface UploadedTicketRepositoryCustom {

    /**
     * Writes every attribute of {@code ticket} in one {@code INSERT ... ON CONFLICT (incident_id)}
     * statement and reports whether the row was created or overwritten.
     */
    MergeOutcome upsert(UploadedTicket ticket);

    /**
     * Inserts {@code ticket} only if its {@code incident_id} is not stored yet. Returns false, and
     * leaves the existing row untouched, when the key is already taken.
     */
    boolean insertIfAbsent(UploadedTicket ticket);

    List<MttrMttiProjectStats> aggregateMttrMttiByProject(UUID projectId, OffsetDateTime start, OffsetDateTime end);

    /**
     * Per-assignee statistics, grouped by mapped email and falling back to the raw assignee.
     */
    List<MttrMttiUserStats> aggregateMttrMttiByUser(OffsetDateTime start, OffsetDateTime end);

    /**
     * Daily averages by {@code reported_date1} over the last {@code days} days, oldest first.
     */
    List<MttrMttiTrendPoint> dailyMttrMttiTrend(UUID projectId, int days);

    /**
     * Average MTTR and MTTI minutes over tickets that carry any derived duration.
     */
    AverageDurations averageMinutes(UUID projectId);

    /**
     * New vs overwritten tickets by {@code updated_at} window, optionally limited to the source an
     * upload session wrote into.
     */
    UpsertStatistics upsertStatistics(UUID sessionId, OffsetDateTime start, OffsetDateTime end);
}
