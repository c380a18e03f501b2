package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.model.NormalizedTicketRecord;
import com.opsdata.ticketingest.model.ResolvedMapping;
import com.opsdata.ticketingest.model.TicketFields;
import com.opsdata.ticketingest.model.TicketMasterMapping;
import com.opsdata.ticketingest.model.TicketUploadMapping;
import com.opsdata.ticketingest.model.TicketUploadUserMapping;
import com.opsdata.ticketingest.repository.TicketMasterMappingRepository;
import com.opsdata.ticketingest.repository.TicketUploadMappingRepository;
import com.opsdata.ticketingest.repository.TicketUploadUserMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a ticket's project and user from the source-scoped mapping tables. Matching is exact
 * (case and whitespace sensitive) on the normalized value. A miss is never an error: the ticket is
 * stored unmapped and reconciled by hand later.
 */
@Service
public class MappingResolver {

    private static final Logger logger = LoggerFactory.getLogger(MappingResolver.class);

    private final TicketUploadMappingRepository uploadMappingRepository;
    private final TicketUploadUserMappingRepository userMappingRepository;
    private final TicketMasterMappingRepository masterMappingRepository;

    public MappingResolver(TicketUploadMappingRepository uploadMappingRepository,
                           TicketUploadUserMappingRepository userMappingRepository,
                           TicketMasterMappingRepository masterMappingRepository) {
        this.uploadMappingRepository = uploadMappingRepository;
        this.userMappingRepository = userMappingRepository;
        this.masterMappingRepository = masterMappingRepository;
    }

    @Transactional(readOnly = true)
    public ResolvedMapping resolve(UUID sourceId, NormalizedTicketRecord record) {
        if (sourceId == null) {
            return ResolvedMapping.unmapped();
        }
        Optional<TicketUploadMapping> mapping = findOrganizationMapping(
                sourceId, record.getOrNull(TicketFields.ASSIGNED_SUPPORT_ORGANIZATION));
        UUID mappingId = mapping.map(TicketUploadMapping::getId).orElse(null);
        UUID projectId = mapping.map(TicketUploadMapping::getProjectId).orElse(null);
        String userEmail = resolveUser(sourceId, record.getOrNull(TicketFields.ASSIGNEE), mappingId).orElse(null);

        if (projectId == null) {
            logger.debug("No organization mapping for source {} and value '{}'",
                    sourceId, record.getOrNull(TicketFields.ASSIGNED_SUPPORT_ORGANIZATION));
        }
        return new ResolvedMapping(projectId, mappingId, userEmail);
    }

    @Transactional(readOnly = true)
    public Optional<UUID> resolveProject(UUID sourceId, String organizationValue) {
        return findOrganizationMapping(sourceId, organizationValue).map(TicketUploadMapping::getProjectId);
    }

    @Transactional(readOnly = true)
    public Optional<String> resolveUser(UUID sourceId, String assigneeValue) {
        return resolveUser(sourceId, assigneeValue, null);
    }

    private Optional<TicketUploadMapping> findOrganizationMapping(UUID sourceId, String organizationValue) {
        if (sourceId == null || organizationValue == null) {
            return Optional.empty();
        }
        List<TicketUploadMapping> matches = uploadMappingRepository
                .findAllBySourceIdAndSourceOrganizationValueOrderByCreatedAtAsc(sourceId, organizationValue);
        if (matches.size() > 1) {
            logger.warn("{} organization mappings match '{}' for source {}; using the oldest",
                    matches.size(), organizationValue, sourceId);
        }
        return matches.stream().findFirst();
    }

    /**
     * User mappings of the source first, preferring the one under {@code preferredMappingId},
     * then active master mappings.
     */
    private Optional<String> resolveUser(UUID sourceId, String assigneeValue, UUID preferredMappingId) {
        if (sourceId == null || assigneeValue == null) {
            return Optional.empty();
        }
        List<UUID> mappingIds = uploadMappingRepository.findAllBySourceId(sourceId).stream()
                .map(TicketUploadMapping::getId)
                .toList();
        if (!mappingIds.isEmpty()) {
            List<TicketUploadUserMapping> userMappings = userMappingRepository
                    .findAllByMappingIdInAndSourceAssigneeValueOrderByCreatedAtAsc(mappingIds, assigneeValue);
            Optional<TicketUploadUserMapping> preferred = userMappings.stream()
                    .filter(m -> m.getMappingId().equals(preferredMappingId))
                    .findFirst();
            Optional<TicketUploadUserMapping> chosen = preferred.isPresent() ? preferred : userMappings.stream().findFirst();
            if (chosen.isPresent()) {
                return Optional.ofNullable(chosen.get().getUserEmail());
            }
        }
        return masterMappingRepository.findBySourceIdAndSourceAssigneeValueAndActiveTrue(sourceId, assigneeValue)
                .map(TicketMasterMapping::getMappedUserEmail);
    }
}
