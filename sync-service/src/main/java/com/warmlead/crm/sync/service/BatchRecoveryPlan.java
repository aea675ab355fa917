package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.retry.RecoveryStrategy;

import java.util.List;

public record BatchRecoveryPlan(
    int retryBatch,
    int startIndex,
    int endIndex,
    List<String> skipContacts,
    RecoveryStrategy strategy,
    long estimatedDurationMs
) {
}
