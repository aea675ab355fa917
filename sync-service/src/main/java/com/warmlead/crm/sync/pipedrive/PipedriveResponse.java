package com.warmlead.crm.sync.pipedrive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope of every Pipedrive v1 response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipedriveResponse<T>(
    boolean success,
    T data,
    String error,
    @JsonProperty("additional_data") AdditionalData additionalData
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AdditionalData(Pagination pagination) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Pagination(
        int start,
        int limit,
        @JsonProperty("more_items_in_collection") boolean moreItemsInCollection,
        @JsonProperty("next_start") Integer nextStart
    ) {
    }

    public boolean hasMoreItems() {
        return additionalData != null
            && additionalData.pagination() != null
            && additionalData.pagination().moreItemsInCollection();
    }
}
