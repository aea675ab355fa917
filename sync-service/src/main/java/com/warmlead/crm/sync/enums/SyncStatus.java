package com.warmlead.crm.sync.enums;

/**
 * Status of one sync run, stored on its SyncHistory row.
 * PENDING while the run is in flight; SUCCESS or FAILED once finalized.
 */
public enum SyncStatus {
    PENDING,
    SUCCESS,
    FAILED
}
