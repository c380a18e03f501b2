package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.model.CategoryOption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CategoryOptionRepository extends JpaRepository<CategoryOption, UUID> {
    boolean existsByCategoryIdAndOptionValue(UUID categoryId, String optionValue);
}
