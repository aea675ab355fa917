package com.warmlead.crm.sync.pipedrive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PipedriveOrganization(
    long id,
    String name,
    String address,
    @JsonProperty("address_country") String addressCountry,
    @JsonProperty("address_locality") String addressLocality,
    String website,
    String industry,
    @JsonProperty("employee_count") Integer employeeCount,
    @JsonProperty("people_count") Integer peopleCount,
    @JsonProperty("add_time") String addTime,
    @JsonProperty("update_time") String updateTime
) {
}
