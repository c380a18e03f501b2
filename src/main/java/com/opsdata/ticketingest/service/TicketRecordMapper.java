package com.opsdata.ticketingest.service;

import com.google.common.collect.ImmutableSet;
import com.opsdata.ticketingest.model.DurationMetrics;
import com.opsdata.ticketingest.model.NormalizedTicketRecord;
import com.opsdata.ticketingest.model.ResolvedMapping;
import com.opsdata.ticketingest.model.UploadedTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import static com.opsdata.ticketingest.model.TicketFields.*;

/**
 * Builds the full {@link UploadedTicket} attribute set from a validated record. Values that do not
 * coerce to their column type are stored as null.
 */
@Component
public class TicketRecordMapper {

    private static final Logger logger = LoggerFactory.getLogger(TicketRecordMapper.class);

    private static final Set<String> TRUE_VALUES = ImmutableSet.of("true", "yes", "y", "1", "on");
    private static final Set<String> FALSE_VALUES = ImmutableSet.of("false", "no", "n", "0", "off");

    private final TemporalParser temporalParser;

    public TicketRecordMapper(TemporalParser temporalParser) {
        this.temporalParser = temporalParser;
    }

    public UploadedTicket toEntity(NormalizedTicketRecord record,
                                   UUID sourceId,
                                   ResolvedMapping mapping,
                                   DurationMetrics metrics) {
        UploadedTicket ticket = new UploadedTicket();
        ticket.setSourceId(sourceId);
        ticket.setMappingId(mapping.mappingId());
        ticket.setProjectId(mapping.projectId());
        ticket.setMappedUserEmail(mapping.userEmail());

        ticket.setIncidentId(record.getOrNull(INCIDENT_ID));
        ticket.setPriority(record.getOrNull(PRIORITY));
        ticket.setRegion(record.getOrNull(REGION));
        ticket.setAssignedSupportOrganization(record.getOrNull(ASSIGNED_SUPPORT_ORGANIZATION));
        ticket.setAssignedGroup(record.getOrNull(ASSIGNED_GROUP));
        ticket.setVertical(record.getOrNull(VERTICAL));
        ticket.setSubVertical(record.getOrNull(SUB_VERTICAL));
        ticket.setOwnerSupportOrganization(record.getOrNull(OWNER_SUPPORT_ORGANIZATION));
        ticket.setOwnerGroup(record.getOrNull(OWNER_GROUP));
        ticket.setOwner(record.getOrNull(OWNER));
        ticket.setReportedSource(record.getOrNull(REPORTED_SOURCE));
        ticket.setUserName(record.getOrNull(USER_NAME));
        ticket.setSiteGroup(record.getOrNull(SITE_GROUP));
        ticket.setOperationalCategoryTier1(record.getOrNull(OPERATIONAL_CATEGORY_TIER_1));
        ticket.setOperationalCategoryTier2(record.getOrNull(OPERATIONAL_CATEGORY_TIER_2));
        ticket.setOperationalCategoryTier3(record.getOrNull(OPERATIONAL_CATEGORY_TIER_3));
        ticket.setProductName(record.getOrNull(PRODUCT_NAME));
        ticket.setProductCategorizationTier1(record.getOrNull(PRODUCT_CATEGORIZATION_TIER_1));
        ticket.setProductCategorizationTier2(record.getOrNull(PRODUCT_CATEGORIZATION_TIER_2));
        ticket.setProductCategorizationTier3(record.getOrNull(PRODUCT_CATEGORIZATION_TIER_3));
        ticket.setIncidentType(record.getOrNull(INCIDENT_TYPE));
        ticket.setSummary(record.getOrNull(SUMMARY));
        ticket.setAssignee(record.getOrNull(ASSIGNEE));
        ticket.setStatus(record.getOrNull(STATUS));
        ticket.setStatusReasonHidden(record.getOrNull(STATUS_REASON_HIDDEN));
        ticket.setPendingReason(record.getOrNull(PENDING_REASON));
        ticket.setDepartment(record.getOrNull(DEPARTMENT));
        ticket.setCompany(record.getOrNull(COMPANY));
        ticket.setVendorTicketNumber(record.getOrNull(VENDOR_TICKET_NUMBER));
        ticket.setResolution(record.getOrNull(RESOLUTION));
        ticket.setResolverGroup(record.getOrNull(RESOLVER_GROUP));
        ticket.setServiceDesk1stAssignedGroup(record.getOrNull(SERVICE_DESK_1ST_ASSIGNED_GROUP));
        ticket.setSubmitter(record.getOrNull(SUBMITTER));
        ticket.setOwnerLoginId(record.getOrNull(OWNER_LOGIN_ID));
        ticket.setImpact(record.getOrNull(IMPACT));
        ticket.setVilFunction(record.getOrNull(VIL_FUNCTION));
        ticket.setItPartner(record.getOrNull(IT_PARTNER));

        ticket.setReportedDate1(timestamp(record, REPORTED_DATE1));
        ticket.setRespondedDate(timestamp(record, RESPONDED_DATE));
        ticket.setLastResolvedDate(timestamp(record, LAST_RESOLVED_DATE));
        ticket.setClosedDate(timestamp(record, CLOSED_DATE));
        ticket.setReopenedDate(timestamp(record, REOPENED_DATE));
        ticket.setServiceDesk1stAssignedDate(timestamp(record, SERVICE_DESK_1ST_ASSIGNED_DATE));
        ticket.setSubmitDate(timestamp(record, SUBMIT_DATE));
        ticket.setReportDate(timestamp(record, REPORT_DATE));

        ticket.setGroupTransfers(integer(record, GROUP_TRANSFERS));
        ticket.setTotalTransfers(integer(record, TOTAL_TRANSFERS));
        ticket.setReopenCount(integer(record, REOPEN_COUNT));

        ticket.setVip(bool(record, VIP));
        ticket.setReportedToVendor(bool(record, REPORTED_TO_VENDOR));

        ticket.setMttr(record.getOrNull(MTTR));
        ticket.setMtti(record.getOrNull(MTTI));
        ticket.setMttrSeconds(metrics.mttrSeconds());
        ticket.setMttrMinutes(metrics.mttrMinutes());
        ticket.setMttiSeconds(metrics.mttiSeconds());
        ticket.setMttiMinutes(metrics.mttiMinutes());
        return ticket;
    }

    private OffsetDateTime timestamp(NormalizedTicketRecord record, String field) {
        String raw = record.getOrNull(field);
        if (raw == null) {
            return null;
        }
        OffsetDateTime parsed = temporalParser.parseTimestamp(raw).orElse(null);
        if (parsed == null) {
            logger.debug("Unparseable {} '{}' on {}; storing null", field, raw, record.getOrNull(INCIDENT_ID));
        }
        return parsed;
    }

    static Integer integer(NormalizedTicketRecord record, String field) {
        String raw = record.getOrNull(field);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            logger.debug("Non-integer {} '{}'; storing null", field, raw);
            return null;
        }
    }

    static Boolean bool(NormalizedTicketRecord record, String field) {
        String raw = record.getOrNull(field);
        if (raw == null) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(value)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(value)) {
            return Boolean.FALSE;
        }
        return null;
    }
}
