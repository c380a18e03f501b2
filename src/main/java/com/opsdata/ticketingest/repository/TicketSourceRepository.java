package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.TicketSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface TicketSourceRepository extends JpaRepository<TicketSource, UUID> {
}
