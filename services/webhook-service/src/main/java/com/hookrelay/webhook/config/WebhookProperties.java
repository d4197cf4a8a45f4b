package com.hookrelay.webhook.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Webhook endpoint and outbound notification settings, bound from {@code hookrelay.webhook.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "hookrelay.webhook")
public class WebhookProperties {

    private Inbound inbound = new Inbound();
    private Processing processing = new Processing();
    private Notification notification = new Notification();

    @Data
    public static class Inbound {
        @Min(1)
        private long teamLimit = 300;

        @Min(1)
        private long ipLimit = 600;

        @NotNull
        private Duration window = Duration.ofMinutes(1);

        /**
         * Maximum time a team lock is held while an event is processed.
         */
        @NotNull
        private Duration teamLockTtl = Duration.ofSeconds(30);

        @Min(0)
        private int teamLockRetries = 20;
    }

    /**
     * Pool that runs accepted events, separate from the resilience pool used by rate-limit checks.
     */
    @Data
    public static class Processing {
        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 500;
    }

    @Data
    public static class Notification {
        /**
         * Downstream endpoint; notifications are disabled while unset.
         */
        private String url;

        @Min(1)
        private long burstCapacity = 10;

        @DecimalMin("0.001")
        private double refillPerSecond = 1.0;

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration retryDelay = Duration.ofMillis(500);

        @Min(1)
        private int failureThreshold = 5;

        @NotNull
        private Duration openTimeout = Duration.ofMinutes(1);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(2);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(5);
    }
}
