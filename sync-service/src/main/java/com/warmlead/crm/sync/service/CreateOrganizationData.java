package com.warmlead.crm.sync.service;

import lombok.Builder;

/**
 * Input for {@link OrganizationService#findOrCreateOrganization}. Only name is required.
 */
@Builder
public record CreateOrganizationData(
    String name,
    String pipedriveOrgId,
    String industry,
    String size,
    String website,
    String address,
    String country,
    String city
) {
}
