package com.warmlead.crm.sync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Pipedrive API client settings.
 * 
 * Maps to:
 * pipedrive:
 *   api:
 *     base-url: https://api.pipedrive.com/v1
 *     request-timeout: 30s
 *     page-size: 100
 */
@Configuration
@ConfigurationProperties(prefix = "pipedrive.api")
@Data
public class PipedriveProperties {

    private String baseUrl = "https://api.pipedrive.com/v1";

    /**
     * Response timeout of a single HTTP request.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Persons fetched per page; every page is one sync batch. Pipedrive caps this at 500.
     */
    private int pageSize = 100;

    private int maxInMemorySize = 10 * 1024 * 1024;
}
