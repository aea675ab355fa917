package com.warmlead.crm.common.remote;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;

/**
 * Outcome of a call to the external CRM.
 * 
 * Remote clients never throw for expected failures (HTTP errors, timeouts); they return
 * a failed result tagged with the error kind they observed so the caller decides
 * whether to retry.
 *
 * @param <T> payload type
 */
public record RemoteCallResult<T>(
    boolean success,
    T data,
    String error,
    ErrorKind errorKind
) {

    public static <T> RemoteCallResult<T> success(T data) {
        return new RemoteCallResult<>(true, data, null, null);
    }

    public static <T> RemoteCallResult<T> failure(ErrorKind kind, String error) {
        return new RemoteCallResult<>(false, null, error, kind);
    }

    /**
     * Return the payload or throw the failure as a tagged {@link SyncException}.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new SyncException(errorKind != null ? errorKind : ErrorKind.EXTERNAL_API,
            error != null ? error : "Pipedrive API error: request failed");
    }
}
