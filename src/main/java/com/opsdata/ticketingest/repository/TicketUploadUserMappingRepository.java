package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.TicketUploadUserMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TicketUploadUserMappingRepository extends JpaRepository<TicketUploadUserMapping, UUID> {
    List<TicketUploadUserMapping> findAllByMappingIdInAndSourceAssigneeValueOrderByCreatedAtAsc(Collection<UUID> mappingIds, String sourceAssigneeValue);
}
