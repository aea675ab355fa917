package com.warmlead.crm.sync.pipedrive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of a person's email or phone list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipedriveContactField(String value, boolean primary, String label) {
}
