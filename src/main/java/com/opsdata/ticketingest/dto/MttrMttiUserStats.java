package com.opsdata.ticketingest.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(description = "MTTR/MTTI totals for one assignee, keyed by mapped email or raw assignee name")
public record MttrMttiUserStats(
        String user,
        long totalTickets,
        BigDecimal avgMttrMinutes,
        BigDecimal avgMttiMinutes,
        BigDecimal totalMttrMinutes,
        BigDecimal totalMttiMinutes,
        @Schema(description = "100 minus average MTTR in hours; 100 when there is no MTTR")
        BigDecimal efficiencyScore
) {}
