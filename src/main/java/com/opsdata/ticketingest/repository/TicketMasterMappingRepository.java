package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.TicketMasterMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TicketMasterMappingRepository extends JpaRepository<TicketMasterMapping, UUID> {
    Optional<TicketMasterMapping> findBySourceIdAndSourceAssigneeValueAndActiveTrue(UUID sourceId, String sourceAssigneeValue);
}
