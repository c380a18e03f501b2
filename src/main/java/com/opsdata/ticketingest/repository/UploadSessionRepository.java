package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.UploadSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Repository
public interface UploadSessionRepository extends JpaRepository<UploadSession, UUID> {

    List<UploadSession> findAllByUserEmailOrderByCreatedAtDesc(String userEmail);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update UploadSession s set s.processedRows = :processedRows, s.updatedAt = CURRENT_TIMESTAMP where s.id = :id")
    int updateProcessedRows(@Param("id") UUID id, @Param("processedRows") int processedRows);
}
