package com.warmlead.crm.sync.repository;

import com.warmlead.crm.sync.entity.User;
import com.warmlead.crm.sync.enums.UserSyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Targeted update of the sync fields only.
     * Avoids a read-modify-write of the whole user from the sync worker thread.
     */
    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.syncStatus = :status, u.lastSyncTimestamp = :lastSyncTimestamp WHERE u.id = :userId")
    int updateSyncState(
        @Param("userId") UUID userId,
        @Param("status") UserSyncStatus status,
        @Param("lastSyncTimestamp") LocalDateTime lastSyncTimestamp
    );

    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.syncStatus = :status WHERE u.id = :userId")
    int updateSyncStatus(@Param("userId") UUID userId, @Param("status") UserSyncStatus status);
}
