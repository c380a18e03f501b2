package com.opsdata.ticketingest.controller;

import com.opsdata.ticketingest.dto.MttrMttiProjectStats;
import com.opsdata.ticketingest.dto.MttrMttiUserStats;
import com.opsdata.ticketingest.dto.PerformanceBenchmark;
import com.opsdata.ticketingest.dto.UpsertStatistics;
import com.opsdata.ticketingest.service.TicketAnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tickets/analytics")
@Tag(name = "Ticket Analytics", description = "MTTR/MTTI reporting over ingested tickets")
public class TicketAnalyticsController {

    private final TicketAnalyticsService analyticsService;

    public TicketAnalyticsController(TicketAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Operation(summary = "MTTR/MTTI statistics per project", description = "Optional window applies to reported_date1.")
    @GetMapping("/mttr-mtti")
    public ResponseEntity<List<MttrMttiProjectStats>> mttrMttiByProject(
            @Parameter(description = "Restrict to one project") @RequestParam(value = "projectId", required = false) UUID projectId,
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end) {
        return ResponseEntity.ok(analyticsService.mttrMttiByProject(projectId, start, end));
    }

    @Operation(summary = "MTTR/MTTI statistics per assignee", description = "Optional window applies to reported_date1.")
    @GetMapping("/mttr-mtti/users")
    public ResponseEntity<List<MttrMttiUserStats>> mttrMttiByUser(
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end) {
        return ResponseEntity.ok(analyticsService.mttrMttiByUser(start, end));
    }

    @Operation(summary = "Daily MTTR/MTTI averages over the last N days")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Daily averages, oldest first"),
            @ApiResponse(responseCode = "400", description = "days out of range")
    })
    @GetMapping("/trends")
    public ResponseEntity<?> trends(
            @Parameter(description = "Restrict to one project") @RequestParam(value = "projectId", required = false) UUID projectId,
            @RequestParam(value = "days", defaultValue = "30") int days) {
        try {
            return ResponseEntity.ok(analyticsService.trends(projectId, days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @Operation(summary = "Average MTTR/MTTI against their targets (30 and 15 minutes)")
    @GetMapping("/benchmarks")
    public ResponseEntity<List<PerformanceBenchmark>> benchmarks(
            @Parameter(description = "Restrict to one project") @RequestParam(value = "projectId", required = false) UUID projectId) {
        return ResponseEntity.ok(analyticsService.benchmarks(projectId));
    }

    @Operation(summary = "New vs updated tickets",
            description = "Optional window applies to updated_at; sessionId limits to the session's source.")
    @GetMapping("/upsert-statistics")
    public ResponseEntity<UpsertStatistics> upsertStatistics(
            @Parameter(description = "Upload session whose source to report on") @RequestParam(value = "sessionId", required = false) UUID sessionId,
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end) {
        return ResponseEntity.ok(analyticsService.upsertStatistics(sessionId, start, end));
    }
}
