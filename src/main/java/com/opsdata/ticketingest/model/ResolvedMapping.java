package com.opsdata.ticketingest.model;

import java.util.UUID;

/**
 * Outcome of mapping resolution for one ticket. Any component may be null, meaning unmapped.
 */
public record ResolvedMapping(UUID projectId, UUID mappingId, String userEmail) {

    public static ResolvedMapping unmapped() {
        return new ResolvedMapping(null, null, null);
    }

    public boolean isProjectMapped() {
        return projectId != null;
    }
}
