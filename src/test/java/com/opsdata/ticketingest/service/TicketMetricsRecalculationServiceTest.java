package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.dto.MetricsRecalculationResult;
import com.opsdata.ticketingest.model.UploadedTicket;
import com.opsdata.ticketingest.repository.UploadedTicketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TicketMetricsRecalculationServiceTest {

    @Mock
    private UploadedTicketRepository uploadedTicketRepository;

    private TicketMetricsRecalculationService service;

    @BeforeEach
    void setUp() {
        service = new TicketMetricsRecalculationService(uploadedTicketRepository,
                new DerivedMetricsCalculator(new TemporalParser("UTC")), 2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void updatesOnlyRowsWhoseMetricsChanged() {
        UploadedTicket stale = ticket("INC1", "02:58:25", null, null, null);
        UploadedTicket current = ticket("INC2", "01:00", 60, new BigDecimal("1.00"), null);
        UploadedTicket cleared = ticket("INC3", "bogus", 99, new BigDecimal("1.65"), null);

        when(uploadedTicketRepository.findWithDurations(PageRequest.of(0, 2)))
                .thenReturn(new PageImpl<>(List.of(stale, current), PageRequest.of(0, 2), 3));
        when(uploadedTicketRepository.findWithDurations(PageRequest.of(1, 2)))
                .thenReturn(new PageImpl<>(List.of(cleared), PageRequest.of(1, 2), 3));

        MetricsRecalculationResult result = service.recalculateAll();

        assertThat(result.scanned()).isEqualTo(3);
        assertThat(result.updated()).isEqualTo(2);
        assertThat(stale.getMttrSeconds()).isEqualTo(10705);
        assertThat(stale.getMttrMinutes()).isEqualByComparingTo("178.42");
        assertThat(cleared.getMttrSeconds()).isNull();
        assertThat(cleared.getMttrMinutes()).isNull();

        ArgumentCaptor<List<UploadedTicket>> captor = ArgumentCaptor.forClass(List.class);
        verify(uploadedTicketRepository, times(2)).saveAll(captor.capture());
        assertThat(captor.getAllValues()).containsExactly(List.of(stale), List.of(cleared));
    }

    @Test
    void minuteComparisonIgnoresScale() {
        UploadedTicket ticket = ticket("INC1", "60", 60, new BigDecimal("1.0"), null);

        boolean changed = TicketMetricsRecalculationService.apply(ticket,
                new DerivedMetricsCalculator(new TemporalParser("UTC")).derive("60", null));

        assertThat(changed).isFalse();
    }

    private static UploadedTicket ticket(String id, String mttr, Integer seconds, BigDecimal minutes, String mtti) {
        UploadedTicket ticket = new UploadedTicket();
        ticket.setIncidentId(id);
        ticket.setMttr(mttr);
        ticket.setMttrSeconds(seconds);
        ticket.setMttrMinutes(minutes);
        ticket.setMtti(mtti);
        return ticket;
    }
}
