package com.warmlead.crm.sync.enums;

/**
 * Coarse sync state kept on the user for display purposes.
 * The SyncHistory table is the source of truth for individual runs.
 */
public enum UserSyncStatus {
    NOT_SYNCED,
    SYNCING,
    COMPLETED,
    FAILED
}
