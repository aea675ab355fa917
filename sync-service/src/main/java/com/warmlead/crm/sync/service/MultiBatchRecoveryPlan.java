package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.retry.RecoveryStrategy;

import java.util.List;

public record MultiBatchRecoveryPlan(
    List<BatchRecoveryPlan> batchesToRetry,
    long totalEstimatedDurationMs,
    RecoveryStrategy strategy
) {
}
