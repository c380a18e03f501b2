package com.opsdata.ticketingest.controller;

import com.opsdata.ticketingest.dto.CategoryMigrationResult;
import com.opsdata.ticketingest.service.CategoryOptionMigrationJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/category-options")
@Tag(name = "Admin", description = "One-off data maintenance")
public class CategoryMigrationController {

    private final CategoryOptionMigrationJob migrationJob;

    public CategoryMigrationController(CategoryOptionMigrationJob migrationJob) {
        this.migrationJob = migrationJob;
    }

    @Operation(summary = "Copy legacy category options into category_options", description = "Re-running is a no-op.")
    @PostMapping("/migrate")
    public ResponseEntity<CategoryMigrationResult> migrate() {
        return ResponseEntity.ok(migrationJob.run());
    }
}
