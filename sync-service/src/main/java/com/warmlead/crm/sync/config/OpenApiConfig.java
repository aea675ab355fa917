package com.warmlead.crm.sync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI crmSyncOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CRM Sync API")
                        .description("Synchronizes Pipedrive persons and organizations into the local contact store. " +
                                "Exposes sync runs, sync progress, person search and organization listing.")
                        .version("1.0.0"));
    }
}
