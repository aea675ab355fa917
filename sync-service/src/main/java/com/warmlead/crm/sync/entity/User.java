package com.warmlead.crm.sync.entity;

import com.warmlead.crm.sync.config.EncryptedStringAttributeConverter;
import com.warmlead.crm.sync.enums.UserSyncStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Account owning contacts and sync runs.
 * Managed by the account module; the sync engine only reads the credential and
 * maintains lastSyncTimestamp and syncStatus.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_email", columnList = "email")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class User extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "name", length = 255)
    private String name;

    @Convert(converter = EncryptedStringAttributeConverter.class)
    @Column(name = "pipedrive_api_key", length = 500)
    private String pipedriveApiKey;

    /**
     * Start time of the last successful sync. Null means the next sync is FULL.
     */
    @Column(name = "last_sync_timestamp")
    private LocalDateTime lastSyncTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false, length = 20)
    private UserSyncStatus syncStatus = UserSyncStatus.NOT_SYNCED;
}
