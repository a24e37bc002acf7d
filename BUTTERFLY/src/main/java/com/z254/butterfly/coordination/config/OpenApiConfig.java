package com.z254.butterfly.coordination.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for BUTTERFLY.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI butterflyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("BUTTERFLY Coordination API")
                        .description("""
                                Breath-paced coordination of two independently evolving wings.

                                ## Features

                                - **State**: consistent snapshots of breath and both wings
                                - **Network**: collapse diagnostics and the bottleneck condition
                                - **Pressure**: trait input feed for violation-pressure scoring
                                """)
                        .version("0.1.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")))
                .tags(List.of(
                        new Tag().name("State").description("Snapshots and the unified transition"),
                        new Tag().name("Wings").description("Wing diagnostics, input and control")));
    }
}
