package com.fountain.pool.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Pool service configuration properties
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fountain.pool")
public class FountainProperties {

    /**
     * Maximum time an operation waits for the ledger lock
     */
    @NotNull
    private Duration lockTimeout = Duration.ofSeconds(5);

    @Valid
    private EventsConfig events = new EventsConfig();

    @Data
    public static class EventsConfig {
        /**
         * Forward committed events to Kafka in addition to in-process listeners
         */
        private boolean kafkaEnabled = false;

        /**
         * Kafka topic for pool events
         */
        @NotBlank
        private String topic = "fountain-pool-events";
    }
}
