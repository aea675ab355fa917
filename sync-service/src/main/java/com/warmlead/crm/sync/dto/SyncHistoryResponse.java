package com.warmlead.crm.sync.dto;

import com.warmlead.crm.sync.entity.SyncHistory;
import com.warmlead.crm.sync.enums.SyncStatus;
import com.warmlead.crm.sync.enums.SyncType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncHistoryResponse {
    private UUID id;
    private SyncType syncType;
    private SyncStatus status;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Long durationMs;
    private Integer contactsTotal;
    private Integer contactsProcessed;
    private Integer contactsCreated;
    private Integer contactsUpdated;
    private Integer contactsFailed;
    private String error;

    public static SyncHistoryResponse from(SyncHistory history) {
        return new SyncHistoryResponse(
            history.getId(),
            history.getSyncType(),
            history.getStatus(),
            history.getStartTime(),
            history.getEndTime(),
            history.getDurationMs(),
            history.getContactsTotal(),
            history.getContactsProcessed(),
            history.getContactsCreated(),
            history.getContactsUpdated(),
            history.getContactsFailed(),
            history.getError()
        );
    }
}
