package com.warmlead.crm.sync.pipedrive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Organization reference embedded in a person.
 * 
 * Pipedrive sends org_id either as a bare number or as an object
 * {value, name, address, ...} depending on the endpoint; both map here.
 */
public record PipedriveOrgReference(Long id, String name, String address) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PipedriveOrgReference fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return new PipedriveOrgReference(node.asLong(), null, null);
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            return text.matches("\\d+") ? new PipedriveOrgReference(Long.parseLong(text), null, null) : null;
        }
        JsonNode value = node.get("value");
        if (value == null || value.isNull()) {
            return null;
        }
        return new PipedriveOrgReference(value.asLong(), textOrNull(node, "name"), textOrNull(node, "address"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode child = node.get(field);
        return child == null || child.isNull() ? null : child.asText();
    }
}
