package com.warmlead.crm.sync.service;

/**
 * @param maxRetries retries after the first attempt
 * @param baseDelayMs base delay between attempts
 * @param timeoutMs deadline for each attempt
 */
public record RecoveryOptions(int maxRetries, long baseDelayMs, long timeoutMs) {

    public static RecoveryOptions defaults() {
        return new RecoveryOptions(3, 1000, 30_000);
    }

    public RecoveryOptions withTimeoutMs(long timeout) {
        return new RecoveryOptions(maxRetries, baseDelayMs, timeout);
    }
}
