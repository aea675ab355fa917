package com.warmlead.crm.common.retry;

/**
 * How a failed sync operation is recovered.
 * 
 * - RETRY_WITH_BACKOFF: retry, doubling the delay after every attempt
 * - RESUME_FROM_LAST_SUCCESS: retry after a flat delay and resume from the last checkpoint
 * - FULL_RETRY: retry the whole operation after a flat delay
 * - NO_RECOVERY: give up immediately, a human has to act first
 */
public enum RecoveryStrategy {
    RETRY_WITH_BACKOFF,
    RESUME_FROM_LAST_SUCCESS,
    FULL_RETRY,
    NO_RECOVERY
}
