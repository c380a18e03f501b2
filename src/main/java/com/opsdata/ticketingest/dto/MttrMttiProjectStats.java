package com.opsdata.ticketingest.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.UUID;

@Schema(description = "Resolution (MTTR) and response (MTTI) interval statistics for one project")
public record MttrMttiProjectStats(
        UUID projectId,
        long totalTickets,
        Integer avgMttrSeconds,
        BigDecimal avgMttrMinutes,
        Integer avgMttiSeconds,
        BigDecimal avgMttiMinutes,
        BigDecimal minMttrMinutes,
        BigDecimal maxMttrMinutes,
        BigDecimal minMttiMinutes,
        BigDecimal maxMttiMinutes
) {}
