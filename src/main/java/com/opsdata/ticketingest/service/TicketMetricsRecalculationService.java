package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.dto.MetricsRecalculationResult;
import com.opsdata.ticketingest.model.DurationMetrics;
import com.opsdata.ticketingest.model.UploadedTicket;
import com.opsdata.ticketingest.repository.UploadedTicketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recomputes the seconds/minutes companions from the stored {@code mttr}/{@code mtti} strings,
 * for rows written before the parser understood a format.
 */
@Service
public class TicketMetricsRecalculationService {

    private static final Logger logger = LoggerFactory.getLogger(TicketMetricsRecalculationService.class);

    private final UploadedTicketRepository uploadedTicketRepository;
    private final DerivedMetricsCalculator metricsCalculator;
    private final int pageSize;

    public TicketMetricsRecalculationService(UploadedTicketRepository uploadedTicketRepository,
                                             DerivedMetricsCalculator metricsCalculator,
                                             @Value("${app.ingestion.recalculate-page-size:500}") int pageSize) {
        this.uploadedTicketRepository = uploadedTicketRepository;
        this.metricsCalculator = metricsCalculator;
        this.pageSize = Math.max(1, pageSize);
    }

    @Transactional
    public MetricsRecalculationResult recalculateAll() {
        int scanned = 0;
        int updated = 0;
        int pageNumber = 0;
        Page<UploadedTicket> page;
        do {
            page = uploadedTicketRepository.findWithDurations(PageRequest.of(pageNumber++, pageSize));
            List<UploadedTicket> changed = new ArrayList<>();
            for (UploadedTicket ticket : page.getContent()) {
                scanned++;
                if (apply(ticket, metricsCalculator.derive(ticket.getMttr(), ticket.getMtti()))) {
                    changed.add(ticket);
                }
            }
            if (!changed.isEmpty()) {
                uploadedTicketRepository.saveAll(changed);
                updated += changed.size();
            }
        } while (page.hasNext());

        logger.info("Duration metrics recalculated: scanned={}, updated={}", scanned, updated);
        return new MetricsRecalculationResult(scanned, updated);
    }

    static boolean apply(UploadedTicket ticket, DurationMetrics metrics) {
        boolean unchanged = Objects.equals(ticket.getMttrSeconds(), metrics.mttrSeconds())
                && Objects.equals(ticket.getMttiSeconds(), metrics.mttiSeconds())
                && sameDecimal(ticket.getMttrMinutes(), metrics.mttrMinutes())
                && sameDecimal(ticket.getMttiMinutes(), metrics.mttiMinutes());
        if (unchanged) {
            return false;
        }
        ticket.setMttrSeconds(metrics.mttrSeconds());
        ticket.setMttrMinutes(metrics.mttrMinutes());
        ticket.setMttiSeconds(metrics.mttiSeconds());
        ticket.setMttiMinutes(metrics.mttiMinutes());
        return true;
    }

    private static boolean sameDecimal(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }
}
