package com.warmlead.crm.sync.entity;

import com.warmlead.crm.sync.enums.SyncStatus;
import com.warmlead.crm.sync.enums.SyncType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One row per sync attempt.
 * 
 * Audit trail of every run and checkpoint source for recovery: the newest SUCCESS
 * row seeds the RecoveryPoint. Rows are never pruned automatically.
 * 
 * Only the sync orchestrator and the timeout/recovery services acting on its behalf
 * write to a row.
 */
@Entity
@Table(name = "sync_history", indexes = {
    @Index(name = "idx_sync_history_user_status", columnList = "user_id, status"),
    @Index(name = "idx_sync_history_end_time", columnList = "end_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SyncHistory extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_type", nullable = false, length = 20)
    private SyncType syncType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SyncStatus status = SyncStatus.PENDING;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "contacts_total")
    private Integer contactsTotal;

    @Column(name = "contacts_processed", nullable = false)
    private Integer contactsProcessed = 0;

    @Column(name = "contacts_created", nullable = false)
    private Integer contactsCreated = 0;

    @Column(name = "contacts_updated", nullable = false)
    private Integer contactsUpdated = 0;

    @Column(name = "contacts_failed", nullable = false)
    private Integer contactsFailed = 0;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;
}
