package com.opsdata.ticketingest.service;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.opsdata.ticketingest.model.IngestionMode;
import com.opsdata.ticketingest.model.NormalizedTicketRecord;
import com.opsdata.ticketingest.model.TicketFields;
import com.opsdata.ticketingest.model.ValidationReason;
import com.opsdata.ticketingest.model.ValidationResult;
import com.opsdata.ticketingest.repository.UploadedTicketRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Row-level checks run before anything is written. Rules are evaluated in order and the first
 * failure wins. Validation never writes; the duplicate check only reads.
 */
@Component
public class TicketRecordValidator {

    private final UploadedTicketRepository uploadedTicketRepository;
    private final TemporalParser temporalParser;
    private final Set<String> validPriorityCodes;

    public TicketRecordValidator(UploadedTicketRepository uploadedTicketRepository,
                                 TemporalParser temporalParser,
                                 @Value("${app.ingestion.valid-priority-codes:SR,INC,CR,PR}") String validPriorityCodes) {
        this.uploadedTicketRepository = uploadedTicketRepository;
        this.temporalParser = temporalParser;
        this.validPriorityCodes = ImmutableSet.copyOf(
                Splitter.on(',').trimResults().omitEmptyStrings().split(validPriorityCodes));
    }

    public ValidationResult validate(NormalizedTicketRecord record, IngestionMode mode) {
        Optional<String> incidentId = record.incidentId();
        if (incidentId.isEmpty()) {
            return ValidationResult.invalid(ValidationReason.MISSING_KEY, "incident_id is required");
        }

        if (mode == IngestionMode.INSERT_ONLY && uploadedTicketRepository.existsByIncidentId(incidentId.get())) {
            return ValidationResult.invalid(ValidationReason.DUPLICATE_KEY,
                    "incident_id " + incidentId.get() + " already exists");
        }

        Optional<String> priority = record.get(TicketFields.PRIORITY);
        if (priority.isPresent() && !validPriorityCodes.contains(priority.get())) {
            return ValidationResult.invalid(ValidationReason.INVALID_ENUM,
                    "priority '" + priority.get() + "' is not one of " + validPriorityCodes);
        }

        Optional<String> reportedDate = record.get(TicketFields.REPORTED_DATE1);
        if (reportedDate.isPresent() && temporalParser.parseTimestamp(reportedDate.get()).isEmpty()) {
            return ValidationResult.invalid(ValidationReason.INVALID_DATE,
                    "reported_date1 '" + reportedDate.get() + "' is not a recognised timestamp");
        }

        return ValidationResult.valid();
    }
}
