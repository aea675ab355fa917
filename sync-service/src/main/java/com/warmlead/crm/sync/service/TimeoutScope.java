package com.warmlead.crm.sync.service;

import java.util.UUID;

/**
 * Identifies the run a deadline guards. Any field may be null; handlers that need
 * a missing field are skipped.
 */
public record TimeoutScope(UUID syncId, UUID userId, Integer batchNumber) {

    public static TimeoutScope none() {
        return new TimeoutScope(null, null, null);
    }

    public static TimeoutScope sync(UUID syncId, UUID userId) {
        return new TimeoutScope(syncId, userId, null);
    }

    public static TimeoutScope batch(UUID syncId, int batchNumber) {
        return new TimeoutScope(syncId, null, batchNumber);
    }
}
