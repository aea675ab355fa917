package com.warmlead.crm.sync.dto;

import java.util.List;

/**
 * One page of organizations. page is 1-based.
 */
public record OrganizationPageResponse(List<OrganizationResponse> organizations, Pagination pagination) {

    public record Pagination(
        int page,
        int limit,
        long total,
        int totalPages,
        boolean hasNext,
        boolean hasPrev
    ) {
    }
}
