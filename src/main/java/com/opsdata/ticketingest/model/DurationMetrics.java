package com.opsdata.ticketingest.model;

import java.math.BigDecimal;

/**
 * Seconds/minutes companions of the two tracked intervals. Null components were absent or
 * unparseable in the source row.
 */
public record DurationMetrics(Integer mttrSeconds,
                              BigDecimal mttrMinutes,
                              Integer mttiSeconds,
                              BigDecimal mttiMinutes) {

    public static DurationMetrics none() {
        return new DurationMetrics(null, null, null, null);
    }
}
