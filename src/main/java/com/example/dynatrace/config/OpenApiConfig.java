package com.example.dynatrace.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI/Swagger documentation.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Dynatrace Config Sync API")
                        .version("1.0.0")
                        .description("REST API for synchronizing configuration objects with a Dynatrace environment.\n\n" +
                                "**Key Features:**\n" +
                                "- Address configs by name instead of Dynatrace id\n" +
                                "- Idempotent upsert: create when absent, replace in place otherwise\n" +
                                "- Version-aware extension uploads"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
