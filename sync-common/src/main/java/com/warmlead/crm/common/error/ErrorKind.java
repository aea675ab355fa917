package com.warmlead.crm.common.error;

/**
 * Classification of failures raised while synchronizing with the external CRM.
 * 
 * Each kind carries the properties the recovery layer needs:
 * - recoverable: whether the run may retry without human intervention
 * - retryAfterMs: suggested wait before the next attempt (0 when none is suggested)
 * - userMessage: actionable text shown instead of the raw exception message
 * 
 * AUTHENTICATION and VALIDATION are terminal for the current run: a user has to
 * fix the credential or the data before a retry can succeed.
 */
public enum ErrorKind {
    RATE_LIMIT(true, 60_000L, "Rate limit exceeded. Please wait a moment and try again."),
    AUTHENTICATION(false, 0L, "Authentication failed. Please check your API key."),
    NETWORK(true, 5_000L, "Network connection issue. Please check your internet connection."),
    DATABASE(true, 0L, "Database connection issue. Please try again later."),
    VALIDATION(false, 0L, "Invalid data format. Please check your input."),
    EXTERNAL_API(true, 0L, "Pipedrive API error. Please try again later."),
    UNKNOWN(true, 0L, "An unexpected error occurred. Please try again.");

    private final boolean recoverable;
    private final long retryAfterMs;
    private final String userMessage;

    ErrorKind(boolean recoverable, long retryAfterMs, String userMessage) {
        this.recoverable = recoverable;
        this.retryAfterMs = retryAfterMs;
        this.userMessage = userMessage;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
