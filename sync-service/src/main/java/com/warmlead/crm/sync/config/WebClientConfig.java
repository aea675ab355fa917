package com.warmlead.crm.sync.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for the Pipedrive client.
 * Uses the Reactor Netty HTTP client only; WebFlux auto-configuration is excluded in
 * SyncServiceApplication so no reactive server starts.
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final PipedriveProperties pipedriveProperties;

    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(pipedriveProperties.getRequestTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize(pipedriveProperties.getMaxInMemorySize()));
    }
}
