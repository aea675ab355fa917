package com.warmlead.crm.sync.pipedrive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Person as returned by the Pipedrive persons endpoints.
 * Only the fields the sync consumes are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipedrivePerson(
    long id,
    String name,
    List<PipedriveContactField> email,
    List<PipedriveContactField> phone,
    @JsonProperty("org_id") PipedriveOrgReference orgId,
    @JsonProperty("org_name") String orgName,
    @JsonProperty("add_time") String addTime,
    @JsonProperty("update_time") String updateTime
) {

    /**
     * Primary email, else the first non-blank one; null when the person has none.
     */
    public String primaryEmail() {
        return primaryValue(email);
    }

    public String primaryPhone() {
        return primaryValue(phone);
    }

    /**
     * Organization name from the embedded reference, falling back to org_name.
     */
    public String organizationName() {
        if (orgId != null && orgId.name() != null && !orgId.name().isBlank()) {
            return orgId.name();
        }
        return orgName != null && !orgName.isBlank() ? orgName : null;
    }

    private static String primaryValue(List<PipedriveContactField> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        String first = null;
        for (PipedriveContactField field : fields) {
            if (field == null || field.value() == null || field.value().isBlank()) {
                continue;
            }
            if (field.primary()) {
                return field.value().trim();
            }
            if (first == null) {
                first = field.value().trim();
            }
        }
        return first;
    }
}
