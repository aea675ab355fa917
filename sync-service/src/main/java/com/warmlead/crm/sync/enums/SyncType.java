package com.warmlead.crm.sync.enums;

public enum SyncType {
    FULL,
    INCREMENTAL
}
