package com.warmlead.crm.sync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retry budget for remote calls made during a sync run.
 */
@Configuration
@ConfigurationProperties(prefix = "crm.sync.recovery")
@Data
public class SyncRecoveryProperties {

    private int maxRetries = 3;

    private long baseDelayMs = 1000;
}
