package com.warmlead.crm.sync.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Initializes EncryptedStringAttributeConverter with the configured key.
 */
@Configuration
@Slf4j
public class EncryptionConfig {

    @Value("${encryption.enabled:false}")
    private boolean encryptionEnabled;

    @Value("${encryption.key:}")
    private String encryptionKey;

    @PostConstruct
    public void initializeEncryption() {
        EncryptedStringAttributeConverter.initialize(encryptionKey, encryptionEnabled);

        if (encryptionEnabled && !encryptionKey.isEmpty()) {
            log.info("Encryption enabled for stored Pipedrive API keys");
        } else if (encryptionEnabled) {
            log.warn("Encryption enabled but no key provided - encryption will be disabled");
        }
    }
}
