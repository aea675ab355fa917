package com.warmlead.crm.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.warmlead.crm.sync.enums.SyncStatus;
import com.warmlead.crm.sync.enums.SyncType;
import com.warmlead.crm.sync.service.MultiBatchRecoveryPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncResult {
    private UUID syncId;
    private SyncType syncType;
    private SyncStatus status;
    private int contactsProcessed;
    private int contactsCreated;
    private int contactsUpdated;
    private int contactsFailed;
    private long syncDurationMs;
    private LocalDateTime lastSyncTimestamp;

    // Set only when status is FAILED
    private String userMessage;

    // Set only when some batches had failed contacts
    private MultiBatchRecoveryPlan recoveryPlan;
}
