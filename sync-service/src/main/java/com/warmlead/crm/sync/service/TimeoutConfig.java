package com.warmlead.crm.sync.service;

/**
 * Deadlines for one sync run.
 *
 * @param syncTimeoutMs deadline for a whole run
 * @param batchTimeoutMs deadline for one batch at the base size
 * @param maxBatchTimeoutMs upper bound for progressive batch deadlines
 * @param progressiveTimeoutEnabled scale batch deadlines with batch size
 */
public record TimeoutConfig(
    long syncTimeoutMs,
    long batchTimeoutMs,
    long maxBatchTimeoutMs,
    boolean progressiveTimeoutEnabled
) {

    public static TimeoutConfig defaults() {
        return new TimeoutConfig(300_000, 30_000, 120_000, true);
    }

    public TimeoutConfig withBatchTimeoutMs(long batchTimeout) {
        return new TimeoutConfig(syncTimeoutMs, batchTimeout, maxBatchTimeoutMs, progressiveTimeoutEnabled);
    }
}
