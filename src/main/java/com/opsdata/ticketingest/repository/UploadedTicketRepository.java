package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.UploadedTicket;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UploadedTicketRepository extends JpaRepository<UploadedTicket, UUID>, UploadedTicketRepositoryCustom {

    boolean existsByIncidentId(String incidentId);

    /**
     * Pages through tickets that carry at least one raw duration string.
     */
    @Query(value = "select t from UploadedTicket t where t.mttr is not null or t.mtti is not null order by t.id",
            countQuery = "select count(t) from UploadedTicket t where t.mttr is not null or t.mtti is not null")
    Page<UploadedTicket> findWithDurations(Pageable pageable);
}
