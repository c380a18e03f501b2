package com.opsdata.ticketingest.dto;

public record MetricsRecalculationResult(int scanned, int updated) {
}
