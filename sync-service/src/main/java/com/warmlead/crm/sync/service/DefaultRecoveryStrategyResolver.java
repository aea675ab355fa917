package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.retry.RecoveryStrategy;
import com.warmlead.crm.common.retry.RecoveryStrategyResolver;
import org.springframework.stereotype.Service;

/**
 * Recovery strategy per error kind for Pipedrive syncs.
 */
@Service
public class DefaultRecoveryStrategyResolver implements RecoveryStrategyResolver {

    @Override
    public RecoveryStrategy resolve(ErrorKind kind) {
        if (kind == null) {
            return RecoveryStrategy.RETRY_WITH_BACKOFF;
        }
        return switch (kind) {
            case RATE_LIMIT -> RecoveryStrategy.RETRY_WITH_BACKOFF;
            case NETWORK -> RecoveryStrategy.RESUME_FROM_LAST_SUCCESS;
            case DATABASE -> RecoveryStrategy.FULL_RETRY;
            case AUTHENTICATION, VALIDATION -> RecoveryStrategy.NO_RECOVERY;
            case EXTERNAL_API, UNKNOWN -> RecoveryStrategy.RETRY_WITH_BACKOFF;
        };
    }
}
