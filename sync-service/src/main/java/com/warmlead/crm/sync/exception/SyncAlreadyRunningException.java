package com.warmlead.crm.sync.exception;

import java.util.UUID;

/**
 * A sync was requested while another one for the same user is still in flight on this node.
 * Mapped to 409 by GlobalExceptionHandler.
 */
public class SyncAlreadyRunningException extends RuntimeException {

    private final UUID userId;

    public SyncAlreadyRunningException(UUID userId) {
        super("A sync is already running for this user");
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }
}
