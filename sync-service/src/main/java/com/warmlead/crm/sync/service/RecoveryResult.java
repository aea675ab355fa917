package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.retry.RecoveryStrategy;

/**
 * Outcome of an operation run with recovery.
 *
 * @param success whether an attempt succeeded
 * @param data result of the successful attempt
 * @param error message of the last failure
 * @param errorKind classified kind of the last failure
 * @param attempts number of attempts actually made, starting at 1
 * @param strategy strategy applied; null when an adaptive run succeeded on its first attempt
 */
public record RecoveryResult<T>(
    boolean success,
    T data,
    String error,
    ErrorKind errorKind,
    int attempts,
    RecoveryStrategy strategy
) {

    static <T> RecoveryResult<T> success(T data, int attempts, RecoveryStrategy strategy) {
        return new RecoveryResult<>(true, data, null, null, attempts, strategy);
    }

    static <T> RecoveryResult<T> failure(String error, ErrorKind kind, int attempts, RecoveryStrategy strategy) {
        return new RecoveryResult<>(false, null, error, kind, attempts, strategy);
    }
}
