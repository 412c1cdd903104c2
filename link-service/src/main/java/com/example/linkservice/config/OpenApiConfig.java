package com.example.linkservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI linkServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Link Service API")
                        .version("1.0.0")
                        .description("""
                                Owns short-link records and keeps the edge redirect cache in sync with them.
                                
                                ## Endpoints
                                - `POST /api/cron/sync-edge`: cron-triggered edge sync (shared secret)
                                - `GET /internal/edge-sync/health`: sync history and derived health (service key)
                                """))
                .components(new Components()
                        .addSecuritySchemes("Cron Secret",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .description("Shared cron secret, also accepted as ?secret="))
                        .addSecuritySchemes("Service Key",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name("X-Service-Key")));
    }
}
