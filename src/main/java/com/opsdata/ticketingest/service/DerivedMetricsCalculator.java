package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.model.DurationMetrics;
import com.opsdata.ticketingest.model.NormalizedTicketRecord;
import com.opsdata.ticketingest.model.TicketFields;
import org.springframework.stereotype.Component;

/**
 * Derives the seconds/minutes companions of {@code mttr} and {@code mtti}. Absent or unparseable
 * durations leave their companions null.
 */
@Component
public class DerivedMetricsCalculator {

    private final TemporalParser temporalParser;

    public DerivedMetricsCalculator(TemporalParser temporalParser) {
        this.temporalParser = temporalParser;
    }

    public DurationMetrics deriveMetrics(NormalizedTicketRecord record) {
        return derive(record.getOrNull(TicketFields.MTTR), record.getOrNull(TicketFields.MTTI));
    }

    public DurationMetrics derive(String mttr, String mtti) {
        return new DurationMetrics(
                temporalParser.parseDurationSeconds(mttr).orElse(null),
                temporalParser.parseDurationMinutes(mttr).orElse(null),
                temporalParser.parseDurationSeconds(mtti).orElse(null),
                temporalParser.parseDurationMinutes(mtti).orElse(null));
    }
}
