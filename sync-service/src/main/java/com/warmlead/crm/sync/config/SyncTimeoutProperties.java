package com.warmlead.crm.sync.config;

import com.warmlead.crm.sync.service.TimeoutConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Deadlines for sync runs and batches.
 * 
 * Maps to:
 * crm:
 *   sync:
 *     timeout:
 *       sync-timeout-ms: 300000
 *       batch-timeout-ms: 30000
 *       max-batch-timeout-ms: 120000
 *       progressive-timeout-enabled: true
 * 
 * Validated at startup by TimeoutProtectionService.
 */
@Configuration
@ConfigurationProperties(prefix = "crm.sync.timeout")
@Data
public class SyncTimeoutProperties {

    private long syncTimeoutMs = 300_000;

    private long batchTimeoutMs = 30_000;

    private long maxBatchTimeoutMs = 120_000;

    private boolean progressiveTimeoutEnabled = true;

    public TimeoutConfig toTimeoutConfig() {
        return new TimeoutConfig(syncTimeoutMs, batchTimeoutMs, maxBatchTimeoutMs, progressiveTimeoutEnabled);
    }
}
