package com.warmlead.crm.sync.service;

import com.warmlead.crm.sync.dto.OrganizationPageResponse;
import com.warmlead.crm.sync.dto.OrganizationResponse;
import com.warmlead.crm.sync.entity.Organization;
import com.warmlead.crm.sync.repository.ContactRepository;
import com.warmlead.crm.sync.repository.OrganizationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Local organizations, deduplicated by Pipedrive id and normalized name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrganizationService {

    private static final Pattern SEPARATORS = Pattern.compile("[.,&_-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final OrganizationRepository organizationRepository;
    private final ContactRepository contactRepository;

    /**
     * Lower-case, turn . , & - _ into spaces, collapse whitespace and trim.
     * "Acme, Inc." and "ACME INC" both become "acme inc".
     */
    public String normalizeOrganizationName(String name) {
        if (name == null) {
            return "";
        }
        String spaced = SEPARATORS.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    /**
     * Find the organization by Pipedrive id or normalized name, or create it.
     * 
     * A found organization without a Pipedrive id gets the supplied one.
     * 
     * ⚠️ MIGRATION SHIM: when neither lookup matches, an organization whose normalized name
     * contains the computed one is reused. Rows written before names were normalized on
     * write only match this way. Remove once those rows have been renormalized.
     */
    @Transactional
    public Organization findOrCreateOrganization(CreateOrganizationData data) {
        if (data.name() == null || data.name().isBlank()) {
            throw new IllegalArgumentException("Organization name is required");
        }
        String normalizedName = normalizeOrganizationName(data.name());
        String pipedriveOrgId = data.pipedriveOrgId() != null && !data.pipedriveOrgId().isBlank()
            ? data.pipedriveOrgId() : null;

        Optional<Organization> existing = Optional.empty();
        if (pipedriveOrgId != null) {
            existing = organizationRepository.findFirstByPipedriveOrgId(pipedriveOrgId);
        }
        if (existing.isEmpty()) {
            existing = organizationRepository.findFirstByNormalizedName(normalizedName);
        }
        if (existing.isEmpty() && !normalizedName.isEmpty()) {
            existing = organizationRepository.findFirstByNormalizedNameContaining(normalizedName);
            existing.ifPresent(org -> log.info("Matched organization '{}' to legacy row {} by partial name",
                data.name(), org.getId()));
        }

        if (existing.isPresent()) {
            Organization organization = existing.get();
            if (pipedriveOrgId != null && organization.getPipedriveOrgId() == null) {
                organization.setPipedriveOrgId(pipedriveOrgId);
                return organizationRepository.save(organization);
            }
            return organization;
        }

        Organization organization = new Organization();
        organization.setName(data.name().trim());
        organization.setNormalizedName(normalizedName);
        organization.setPipedriveOrgId(pipedriveOrgId);
        organization.setIndustry(data.industry());
        organization.setSize(data.size());
        organization.setWebsite(data.website());
        organization.setAddress(data.address());
        organization.setCountry(data.country());
        organization.setCity(data.city());
        Organization saved = organizationRepository.save(organization);
        log.debug("Created organization {} ({})", saved.getId(), normalizedName);
        return saved;
    }

    /**
     * Refresh the denormalized contact count and last activity of one organization.
     * Last activity is the most recent lastContacted among its contacts.
     */
    @Transactional
    public void updateOrganizationStats(UUID organizationId) {
        Organization organization = organizationRepository.findById(organizationId)
            .orElseThrow(() -> new IllegalArgumentException("Organization not found: " + organizationId));
        organization.setContactCount((int) contactRepository.countByOrganizationId(organizationId));
        organization.setLastActivity(contactRepository.findLatestContactActivity(organizationId));
        organizationRepository.save(organization);
    }

    public Optional<Organization> findOrganizationMatch(String name) {
        return organizationRepository.findFirstByNormalizedName(normalizeOrganizationName(name));
    }

    /**
     * Organizations holding at least one of the user's contacts, largest first.
     *
     * @param page 1-based page number
     * @param limit page size
     * @param search optional case-insensitive name filter
     */
    @Transactional(readOnly = true)
    public OrganizationPageResponse getOrganizationsForUser(UUID userId, int page, int limit, String search) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }
        String filter = search != null && !search.isBlank() ? search.trim().toLowerCase(Locale.ROOT) : null;
        Page<Organization> result = organizationRepository.findForUser(userId, filter, PageRequest.of(page - 1, limit));
        long total = result.getTotalElements();
        int totalPages = (int) Math.ceil((double) total / limit);
        return new OrganizationPageResponse(
            result.getContent().stream().map(OrganizationResponse::from).toList(),
            new OrganizationPageResponse.Pagination(page, limit, total, totalPages,
                (long) page * limit < total, page > 1));
    }
}
