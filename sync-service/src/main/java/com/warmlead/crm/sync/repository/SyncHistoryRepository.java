package com.warmlead.crm.sync.repository;

import com.warmlead.crm.sync.entity.SyncHistory;
import com.warmlead.crm.sync.enums.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Sync run audit rows.
 * 
 * ⚠️ Writes during a run go through the targeted @Modifying updates below, never
 * through save() of a stale entity: the timeout handler and the worker thread may
 * touch the same row and must not overwrite each other's fields.
 */
@Repository
public interface SyncHistoryRepository extends JpaRepository<SyncHistory, UUID> {

    Optional<SyncHistory> findFirstByUserIdAndStatusOrderByEndTimeDesc(UUID userId, SyncStatus status);

    Optional<SyncHistory> findFirstByUserIdOrderByStartTimeDesc(UUID userId);

    Optional<SyncHistory> findByIdAndUserId(UUID id, UUID userId);

    @Modifying
    @Transactional
    @Query("UPDATE SyncHistory s SET s.contactsProcessed = :processed, s.contactsCreated = :created, " +
           "s.contactsUpdated = :updated, s.contactsFailed = :failed WHERE s.id = :id")
    int updateProgress(
        @Param("id") UUID id,
        @Param("processed") int processed,
        @Param("created") int created,
        @Param("updated") int updated,
        @Param("failed") int failed
    );

    @Modifying
    @Transactional
    @Query("UPDATE SyncHistory s SET s.status = :status, s.endTime = :endTime, s.durationMs = :durationMs, " +
           "s.contactsProcessed = :processed, s.contactsCreated = :created, s.contactsUpdated = :updated, " +
           "s.contactsFailed = :failed, s.error = :error WHERE s.id = :id AND s.status = com.warmlead.crm.sync.enums.SyncStatus.PENDING")
    int finalizeRun(
        @Param("id") UUID id,
        @Param("status") SyncStatus status,
        @Param("endTime") LocalDateTime endTime,
        @Param("durationMs") long durationMs,
        @Param("processed") int processed,
        @Param("created") int created,
        @Param("updated") int updated,
        @Param("failed") int failed,
        @Param("error") String error
    );

    @Modifying
    @Transactional
    @Query("UPDATE SyncHistory s SET s.status = com.warmlead.crm.sync.enums.SyncStatus.FAILED, " +
           "s.error = :error, s.endTime = :endTime WHERE s.id = :id")
    int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("endTime") LocalDateTime endTime);

    @Modifying
    @Transactional
    @Query("UPDATE SyncHistory s SET s.error = :error, s.endTime = :endTime WHERE s.id = :id")
    int recordError(@Param("id") UUID id, @Param("error") String error, @Param("endTime") LocalDateTime endTime);
}
