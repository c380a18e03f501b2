package com.opsdata.ticketingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One rejected row. {@code incidentId} is null when the row had no business key.
 */
public record IngestionError(
        @JsonProperty("incident_id") String incidentId,
        @JsonProperty("reason") String reason,
        @JsonProperty("detail") String detail
) {
    public String toLogLine() {
        return (incidentId != null ? incidentId : "<no incident_id>") + ": " + reason + " - " + detail;
    }
}
