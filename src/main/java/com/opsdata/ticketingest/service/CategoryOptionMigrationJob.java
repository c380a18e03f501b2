package com.opsdata.ticketingest.service;

import com.google.common.base.Splitter;
import com.opsdata.ticketingest.dto.CategoryMigrationResult;
import com.opsdata.ticketingest.model.CategoryOption;
import com.opsdata.ticketingest.model.CategoryOptionMigration;
import com.opsdata.ticketingest.model.ProjectCategory;
import com.opsdata.ticketingest.repository.CategoryOptionMigrationRepository;
import com.opsdata.ticketingest.repository.CategoryOptionRepository;
import com.opsdata.ticketingest.repository.ProjectCategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One-shot copy of legacy category options into {@code category_options}. Safe to re-run: migrated
 * categories are remembered and option rows are keyed by (category, value).
 */
@Component
public class CategoryOptionMigrationJob {

    private static final Logger logger = LoggerFactory.getLogger(CategoryOptionMigrationJob.class);

    static final String SOURCE_JSON = "json";
    static final String SOURCE_DESCRIPTION = "description";

    private static final String DESCRIPTION_MARKER = "options:";
    private static final Splitter OPTION_SPLITTER = Splitter.on(',');

    private final ProjectCategoryRepository projectCategoryRepository;
    private final CategoryOptionRepository categoryOptionRepository;
    private final CategoryOptionMigrationRepository migrationRepository;

    public CategoryOptionMigrationJob(ProjectCategoryRepository projectCategoryRepository,
                                      CategoryOptionRepository categoryOptionRepository,
                                      CategoryOptionMigrationRepository migrationRepository) {
        this.projectCategoryRepository = projectCategoryRepository;
        this.categoryOptionRepository = categoryOptionRepository;
        this.migrationRepository = migrationRepository;
    }

    @Transactional
    public CategoryMigrationResult run() {
        int scanned = 0;
        int migrated = 0;
        int skipped = 0;
        int optionsCreated = 0;

        for (ProjectCategory category : projectCategoryRepository.findAll()) {
            scanned++;
            if (migrationRepository.existsById(category.getId())) {
                skipped++;
                continue;
            }
            String source;
            List<String> options;
            if (category.getOptions() != null && !category.getOptions().isEmpty()) {
                source = SOURCE_JSON;
                options = category.getOptions();
            } else if (category.getDescription() != null && category.getDescription().contains(DESCRIPTION_MARKER)) {
                source = SOURCE_DESCRIPTION;
                options = optionsFromDescription(category.getDescription());
            } else {
                skipped++;
                continue;
            }

            int created = 0;
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < options.size(); i++) {
                String value = options.get(i) == null ? "" : options.get(i).trim();
                if (value.isEmpty() || !seen.add(value)
                        || categoryOptionRepository.existsByCategoryIdAndOptionValue(category.getId(), value)) {
                    continue;
                }
                categoryOptionRepository.save(new CategoryOption(category.getId(), value, i));
                created++;
            }
            migrationRepository.save(new CategoryOptionMigration(category.getId(), source, created));
            migrated++;
            optionsCreated += created;
            logger.debug("Migrated {} options for category {} from {}", created, category.getId(), source);
        }

        logger.info("Category option migration: scanned={}, migrated={}, skipped={}, optionsCreated={}",
                scanned, migrated, skipped, optionsCreated);
        return new CategoryMigrationResult(scanned, migrated, skipped, optionsCreated);
    }

    // "Category with options: a, b" -> [" a", " b"]
    static List<String> optionsFromDescription(String description) {
        int start = description.indexOf(DESCRIPTION_MARKER) + DESCRIPTION_MARKER.length();
        String tail = description.substring(start);
        int next = tail.indexOf(DESCRIPTION_MARKER);
        if (next >= 0) {
            tail = tail.substring(0, next);
        }
        return new ArrayList<>(OPTION_SPLITTER.splitToList(tail));
    }
}
