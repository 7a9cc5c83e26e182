package com.relay.notification.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI notificationFilterOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Notification Filter API")
                        .version("1.0.0")
                        .description(
                                "Context-aware filtering and prioritization of notification batches.\n\n" +
                                "**Filter Pipeline:**\n" +
                                "1. Rule stage: criteria derived from the context snapshot and user preferences\n" +
                                "2. Context stage: weighted relevance across user role, workflow, system, time and history\n" +
                                "3. Prediction stage (optional): pluggable relevance predictor with per-item timeout\n" +
                                "4. Behavior stage: per-user preferred categories/types and fatigue gate\n" +
                                "5. Rate limit: keep the highest priority, earliest notifications up to the hourly cap\n" +
                                "6. Explanations for every excluded notification plus aggregate recommendations\n\n" +
                                "If any stage fails the batch is filtered by rules only, `mlConfidence` is 0.5 and the " +
                                "recommendation `ML filtering unavailable - using basic filtering` is added.")
                        .contact(new Contact().name("Notification Platform Team")));
    }
}
