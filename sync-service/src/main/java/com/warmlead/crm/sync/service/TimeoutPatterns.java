package com.warmlead.crm.sync.service;

public record TimeoutPatterns(
    int timeoutCount,
    int totalBatches,
    double timeoutRate,
    double averageDurationMs,
    long maxDurationMs
) {

    static TimeoutPatterns empty() {
        return new TimeoutPatterns(0, 0, 0, 0, 0);
    }
}
