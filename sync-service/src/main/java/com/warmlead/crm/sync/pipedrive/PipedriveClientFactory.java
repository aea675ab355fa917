package com.warmlead.crm.sync.pipedrive;

import com.warmlead.crm.sync.config.PipedriveProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates a Pipedrive client bound to one user's API token.
 */
@Component
@RequiredArgsConstructor
public class PipedriveClientFactory {

    private final WebClient.Builder webClientBuilder;
    private final PipedriveProperties properties;

    /**
     * @throws PipedriveConfigurationException when the key is null or blank
     */
    public PipedriveClient create(String apiKey) {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new PipedriveConfigurationException("No Pipedrive API key configured");
        }
        WebClient webClient = webClientBuilder.clone()
            .baseUrl(properties.getBaseUrl())
            .build();
        return new WebClientPipedriveClient(webClient, apiKey.trim(), properties.getRequestTimeout());
    }
}
