package com.opsdata.ticketingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A ticket row after field cleanup. Only fields with a value are kept, so a field that is
 * missing here was either not supplied or blank in the export.
 */
public final class NormalizedTicketRecord {

    private final Map<String, String> values;

    public NormalizedTicketRecord(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<String> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public String getOrNull(String field) {
        return values.get(field);
    }

    public Optional<String> incidentId() {
        return get(TicketFields.INCIDENT_ID);
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "NormalizedTicketRecord" + values;
    }
}
