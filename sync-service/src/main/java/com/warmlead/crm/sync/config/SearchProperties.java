package com.warmlead.crm.sync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Person search limits.
 * 
 * Maps to:
 * crm:
 *   search:
 *     cache-ttl: 5m
 *     cache-max-entries: 100
 *     rate-limit-max-requests: 10
 *     rate-limit-window: 1m
 *     min-query-length: 3
 */
@Configuration
@ConfigurationProperties(prefix = "crm.search")
@Data
public class SearchProperties {

    private Duration cacheTtl = Duration.ofMinutes(5);

    private int cacheMaxEntries = 100;

    private int rateLimitMaxRequests = 10;

    private Duration rateLimitWindow = Duration.ofMinutes(1);

    private int minQueryLength = 3;
}
