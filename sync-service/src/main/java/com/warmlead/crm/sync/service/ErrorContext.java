package com.warmlead.crm.sync.service;

import java.util.UUID;

/**
 * Where an error happened. batchNumber is null for run-level errors.
 */
public record ErrorContext(UUID userId, UUID syncId, Integer batchNumber) {

    public static ErrorContext forRun(UUID userId, UUID syncId) {
        return new ErrorContext(userId, syncId, null);
    }
}
