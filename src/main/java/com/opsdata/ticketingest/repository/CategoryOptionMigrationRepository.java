package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.CategoryOptionMigration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CategoryOptionMigrationRepository extends JpaRepository<CategoryOptionMigration, UUID> {
}
