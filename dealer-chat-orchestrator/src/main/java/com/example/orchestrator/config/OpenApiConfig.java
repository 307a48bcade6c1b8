package com.example.orchestrator.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Dealer Chat Orchestrator API",
                        version = "1.0",
                        description = "Gateway webhooks and conversation administration for dealership WhatsApp channels.",
                        contact = @Contact(name = "Dealer Chat Team", email = "support@example.com")))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi webhookApi() {
        return GroupedOpenApi.builder()
                .group("webhooks")
                .pathsToMatch("/api/webhooks/**")
                .build();
    }

    @Bean
    public GroupedOpenApi conversationApi() {
        return GroupedOpenApi.builder()
                .group("conversations")
                .pathsToMatch("/api/conversations/**")
                .build();
    }
}
