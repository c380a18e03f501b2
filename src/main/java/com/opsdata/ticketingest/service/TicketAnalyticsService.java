package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.dto.AverageDurations;
import com.opsdata.ticketingest.dto.MttrMttiProjectStats;
import com.opsdata.ticketingest.dto.MttrMttiTrendPoint;
import com.opsdata.ticketingest.dto.MttrMttiUserStats;
import com.opsdata.ticketingest.dto.PerformanceBenchmark;
import com.opsdata.ticketingest.dto.UpsertStatistics;
import com.opsdata.ticketingest.repository.UploadedTicketRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read-only reporting over the derived duration columns.
 */
@Service
public class TicketAnalyticsService {

    public static final String MTTR_METRIC = "MTTR";
    public static final String MTTI_METRIC = "MTTI";

    static final BigDecimal MTTR_TARGET_MINUTES = BigDecimal.valueOf(30);
    static final BigDecimal MTTI_TARGET_MINUTES = BigDecimal.valueOf(15);

    static final int MAX_TREND_DAYS = 366;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final UploadedTicketRepository uploadedTicketRepository;

    public TicketAnalyticsService(UploadedTicketRepository uploadedTicketRepository) {
        this.uploadedTicketRepository = uploadedTicketRepository;
    }

    @Transactional(readOnly = true)
    public List<MttrMttiProjectStats> mttrMttiByProject(UUID projectId, OffsetDateTime start, OffsetDateTime end) {
        return uploadedTicketRepository.aggregateMttrMttiByProject(projectId, start, end);
    }

    @Transactional(readOnly = true)
    public List<MttrMttiUserStats> mttrMttiByUser(OffsetDateTime start, OffsetDateTime end) {
        return uploadedTicketRepository.aggregateMttrMttiByUser(start, end);
    }

    @Transactional(readOnly = true)
    public List<MttrMttiTrendPoint> trends(UUID projectId, int days) {
        if (days < 1 || days > MAX_TREND_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_TREND_DAYS);
        }
        return uploadedTicketRepository.dailyMttrMttiTrend(projectId, days);
    }

    @Transactional(readOnly = true)
    public List<PerformanceBenchmark> benchmarks(UUID projectId) {
        AverageDurations averages = uploadedTicketRepository.averageMinutes(projectId);
        BigDecimal mttr = averages != null ? averages.mttrMinutes() : null;
        BigDecimal mtti = averages != null ? averages.mttiMinutes() : null;
        return List.of(
                benchmark(MTTR_METRIC, mttr, MTTR_TARGET_MINUTES),
                benchmark(MTTI_METRIC, mtti, MTTI_TARGET_MINUTES));
    }

    @Transactional(readOnly = true)
    public UpsertStatistics upsertStatistics(UUID sessionId, OffsetDateTime start, OffsetDateTime end) {
        return uploadedTicketRepository.upsertStatistics(sessionId, start, end);
    }

    /**
     * Tiers are multiples of the target: within it, twice, four times, and beyond.
     */
    static PerformanceBenchmark benchmark(String metric, BigDecimal average, BigDecimal target) {
        BigDecimal current = average != null ? average : BigDecimal.ZERO;
        BigDecimal percentage = current.signum() > 0
                ? target.divide(current, 6, RoundingMode.HALF_UP).multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        return new PerformanceBenchmark(metric, current, target, percentage, tier(current, target));
    }

    static String tier(BigDecimal current, BigDecimal target) {
        if (current.compareTo(target) <= 0) {
            return "Excellent";
        }
        if (current.compareTo(target.multiply(BigDecimal.valueOf(2))) <= 0) {
            return "Good";
        }
        if (current.compareTo(target.multiply(BigDecimal.valueOf(4))) <= 0) {
            return "Fair";
        }
        return "Needs Improvement";
    }
}
