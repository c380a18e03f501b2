package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.model.MergeOutcome;
import com.opsdata.ticketingest.model.UploadedTicket;
import com.opsdata.ticketingest.repository.UploadedTicketRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes one ticket as a single keyed insert-or-replace. Runs in its own transaction so a failed
 * record rolls back alone and never poisons the rest of the batch.
 */
@Service
public class TicketUpsertService {

    private final UploadedTicketRepository uploadedTicketRepository;

    public TicketUpsertService(UploadedTicketRepository uploadedTicketRepository) {
        this.uploadedTicketRepository = uploadedTicketRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public MergeOutcome merge(UploadedTicket ticket) {
        return uploadedTicketRepository.upsert(ticket);
    }

    /**
     * Insert-only write. The unique key decides, so a row stored concurrently by another batch is
     * never overwritten.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean insertNew(UploadedTicket ticket) {
        return uploadedTicketRepository.insertIfAbsent(ticket);
    }
}
