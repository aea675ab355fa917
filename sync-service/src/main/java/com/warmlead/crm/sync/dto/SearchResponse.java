package com.warmlead.crm.sync.dto;

import com.warmlead.crm.sync.pipedrive.PipedrivePerson;

import java.util.List;

/**
 * @param cached whether the results came from the search cache
 */
public record SearchResponse(List<PipedrivePerson> results, int count, boolean cached) {
}
