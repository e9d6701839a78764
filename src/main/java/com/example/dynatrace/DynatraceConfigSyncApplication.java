package com.example.dynatrace;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application class for Dynatrace Config Sync.
 * 
 * This application keeps configuration objects of a Dynatrace environment in line
 * with locally described ones. Objects are addressed by their human-readable name:
 * - Configs are created when no object with the name exists yet
 * - Existing configs are replaced in place, keeping their Dynatrace id
 * - Extensions are uploaded as zip archives instead of plain JSON
 */
@SpringBootApplication
@OpenAPIDefinition(
    info = @Info(
        title = "Dynatrace Config Sync API",
        version = "1.0.0",
        description = "REST API for reading, upserting and deleting Dynatrace configuration objects by name.",
        contact = @Contact(
            name = "API Support",
            email = "support@example.com"
        ),
        license = @License(
            name = "Apache 2.0",
            url = "https://www.apache.org/licenses/LICENSE-2.0"
        )
    )
)
public class DynatraceConfigSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(DynatraceConfigSyncApplication.class, args);
    }
}
