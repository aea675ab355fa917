package com.warmlead.crm.common.error;

import java.util.OptionalLong;

/**
 * Result of classifying a failure.
 *
 * @param kind          classified error kind
 * @param recoverable   false only for kinds that need human intervention
 * @param retryAfterMs  suggested delay, present only for RATE_LIMIT and NETWORK
 * @param userMessage   fixed, kind-specific message safe to show to a user
 */
public record ErrorClassification(
    ErrorKind kind,
    boolean recoverable,
    OptionalLong retryAfterMs,
    String userMessage
) {

    public static ErrorClassification of(ErrorKind kind) {
        OptionalLong retryAfter = kind.getRetryAfterMs() > 0
            ? OptionalLong.of(kind.getRetryAfterMs())
            : OptionalLong.empty();
        return new ErrorClassification(kind, kind.isRecoverable(), retryAfter, kind.getUserMessage());
    }
}
