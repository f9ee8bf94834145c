package com.z254.agora.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for AGORA service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI agoraOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("AGORA API")
                        .description("""
                                AGORA - Multi-agent deliberation service for stress-testing ideas.

                                ## Protocol
                                - **Round 1**: independent analysis by three backend models
                                - **Round 2**: anonymized cross-reading of the other analyses
                                - **Round 3**: synthesis into a structured verdict

                                ## Usage
                                Submit a thesis to `/v1/deliberate`, then poll the returned `poll_url`
                                until the job is `completed` or `failed`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("254STUDIOZ Engineering")
                                .email("engineering@254carbon.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://254carbon.com/licenses")))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8000").description("Local development")
                ));
    }
}
