package com.warmlead.crm.sync.service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One batch deadline sample.
 */
public record TimeoutMetrics(
    UUID syncId,
    int batchNumber,
    long timeoutMs,
    long actualDurationMs,
    boolean wasTimeout,
    LocalDateTime timestamp
) {
}
