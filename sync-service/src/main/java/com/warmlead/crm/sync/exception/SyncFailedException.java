package com.warmlead.crm.sync.exception;

import com.warmlead.crm.common.error.ErrorClassification;
import com.warmlead.crm.common.error.SyncException;
import com.warmlead.crm.sync.service.BatchRecoveryPlan;

import java.util.UUID;

/**
 * A sync run ended on a fatal error.
 * 
 * Carries the classification so callers surface {@link #getUserMessage()} instead of
 * the raw cause. syncId is null when the run failed before its history row was created.
 */
public class SyncFailedException extends SyncException {

    private final ErrorClassification classification;
    private final UUID syncId;
    private final BatchRecoveryPlan recoveryPlan;

    public SyncFailedException(ErrorClassification classification, UUID syncId, String message,
                               BatchRecoveryPlan recoveryPlan, Throwable cause) {
        super(classification.kind(), message, cause);
        this.classification = classification;
        this.syncId = syncId;
        this.recoveryPlan = recoveryPlan;
    }

    public ErrorClassification getClassification() {
        return classification;
    }

    public UUID getSyncId() {
        return syncId;
    }

    public BatchRecoveryPlan getRecoveryPlan() {
        return recoveryPlan;
    }

    public String getUserMessage() {
        return classification.userMessage();
    }
}
