package com.warmlead.crm.sync.service;

import java.time.LocalDateTime;

/**
 * Counters of the newest successful sync, used to resume a later one.
 */
public record RecoveryPoint(
    int contactsProcessed,
    int contactsUpdated,
    int contactsCreated,
    int contactsFailed,
    LocalDateTime lastSuccessfulTime
) {
}
