package com.warmlead.crm.sync.pipedrive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PipedriveUser(long id, String name, String email) {
}
