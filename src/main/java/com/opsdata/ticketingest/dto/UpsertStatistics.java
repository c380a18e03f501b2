package com.opsdata.ticketingest.dto;

import java.util.List;

/**
 * Tickets never touched since creation vs tickets overwritten by a later ingestion.
 */
public record UpsertStatistics(long totalRecords,
                               long newRecords,
                               long updatedRecords,
                               List<String> updatedIncidentIds) {
}
