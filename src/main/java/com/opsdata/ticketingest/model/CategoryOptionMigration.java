package com.opsdata.ticketingest.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Marks a {@link ProjectCategory} whose options were already copied into {@code category_options}.
 * The category id is the key, so a second run of the migration skips the row.
 */
@Setter
@Getter
@Entity
@Table(name = "category_option_migrations")
public class CategoryOptionMigration {

    @Id
    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "option_source", nullable = false, length = 20)
    private String optionSource;

    @Column(name = "options_created", nullable = false)
    private int optionsCreated;

    @Column(name = "migrated_at", nullable = false)
    private OffsetDateTime migratedAt;

    public CategoryOptionMigration() {
    }

    public CategoryOptionMigration(UUID categoryId, String optionSource, int optionsCreated) {
        this.categoryId = categoryId;
        this.optionSource = optionSource;
        this.optionsCreated = optionsCreated;
        this.migratedAt = OffsetDateTime.now();
    }
}
