package com.example.datadestruction.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties shared by the on-demand and scheduled destruction paths.
 * These values are bound from application.yml (destruction.*).
 *
 * The project names the deployment environment (dev, stg, prod...) and prefixes every physical
 * table name, so the same build runs unmodified against each environment. It is resolved from
 * the execution context (APP_ENV) and never hardcoded per environment.
 */
@Component
@ConfigurationProperties(prefix = "destruction")
@Validated
@Data
public class DestructionProperties {

    @NotBlank
    private String project = "local";

    @Valid
    private Store store = new Store();

    @Data
    public static class Store {
        // Re-submissions of UnprocessedItems per BatchWriteItem chunk before giving up
        @Min(0)
        private int maxBatchRetries = 5;

        // Attempts per store call under the SDK's standard retry strategy, first try included
        @Min(1)
        private int sdkMaxAttempts = 3;
    }
}
