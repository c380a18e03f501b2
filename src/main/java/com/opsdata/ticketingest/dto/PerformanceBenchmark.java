package com.opsdata.ticketingest.dto;

import java.math.BigDecimal;

public record PerformanceBenchmark(String metricName,
                                   BigDecimal currentAverage,
                                   BigDecimal targetValue,
                                   BigDecimal performancePercentage,
                                   String status) {
}
