package com.fintech.credits.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * API document for the ledger. Webhook endpoints are listed with the rest but are called by
 * the PSPs, not by clients.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI creditLedgerOpenAPI(@Value("${spring.application.name:credit-ledger-service}") String applicationName,
                                       @Value("${ledger.api.public-url:http://localhost:8080}") String publicUrl,
                                       @Value("${ledger.api.contact-email:payments-platform@semo.dev}") String contactEmail,
                                       @Value("${ledger.default-service-provider:semo}") String defaultServiceProvider) {
        return new OpenAPI()
                .info(new Info()
                        .title("Credit Ledger Service API")
                        .description("Per-subject credit balances with an append-only ledger, fed exactly once by "
                                + "Stripe and Toss notifications. Balances are keyed by subject and provider tag; "
                                + "subscription payments credit the '" + defaultServiceProvider + "' tag unless the "
                                + "payment metadata names another.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Payments Platform")
                                .email(contactEmail)))
                .servers(List.of(new Server().url(publicUrl).description(applicationName)));
    }
}
