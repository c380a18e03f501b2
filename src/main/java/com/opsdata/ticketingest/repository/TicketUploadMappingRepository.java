package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.TicketUploadMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TicketUploadMappingRepository extends JpaRepository<TicketUploadMapping, UUID> {
    /**
     * Exact, case-sensitive match on the organization value.
     */
    List<TicketUploadMapping> findAllBySourceIdAndSourceOrganizationValueOrderByCreatedAtAsc(UUID sourceId, String sourceOrganizationValue);

    List<TicketUploadMapping> findAllBySourceId(UUID sourceId);
}
