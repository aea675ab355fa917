package com.warmlead.crm.sync.dto;

import com.warmlead.crm.sync.enums.SyncType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Options for one sync run. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    /**
     * Forces FULL or INCREMENTAL. When absent the user's last sync timestamp decides.
     */
    private SyncType syncType;

    /**
     * Lower bound for an INCREMENTAL sync, in UTC. Defaults to the user's last sync timestamp.
     */
    private LocalDateTime sinceTimestamp;

    /**
     * Pipedrive page size. Defaults to pipedrive.api.page-size.
     */
    @Min(value = 1, message = "batchSize must be at least 1")
    @Max(value = 500, message = "batchSize cannot exceed 500")
    private Integer batchSize;

    /**
     * Start after the contacts processed by the newest successful sync.
     */
    private boolean resumeFromLastSuccess;

    public static SyncRequest defaults() {
        return new SyncRequest();
    }
}
