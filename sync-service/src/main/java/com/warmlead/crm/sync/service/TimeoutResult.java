package com.warmlead.crm.sync.service;

/**
 * Outcome of a deadline-guarded operation.
 *
 * @param failure the exception that ended the operation, including the deadline's own
 * @param durationMs wall-clock time until the operation or the deadline settled
 */
public record TimeoutResult<T>(
    boolean success,
    T data,
    String error,
    Exception failure,
    boolean timedOut,
    long durationMs
) {

    static <T> TimeoutResult<T> success(T data, long durationMs) {
        return new TimeoutResult<>(true, data, null, null, false, durationMs);
    }

    static <T> TimeoutResult<T> failure(Exception failure, boolean timedOut, long durationMs) {
        return new TimeoutResult<>(false, null, failure.getMessage(), failure, timedOut, durationMs);
    }
}
