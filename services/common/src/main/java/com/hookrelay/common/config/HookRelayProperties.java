package com.hookrelay.common.config;

import com.hookrelay.common.idempotency.StoreFailurePolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the resilience core, bound from {@code hookrelay.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "hookrelay")
public class HookRelayProperties {

    private Store store = new Store();
    private Signature signature = new Signature();
    private Idempotency idempotency = new Idempotency();
    private Lock lock = new Lock();
    private RateLimit rateLimit = new RateLimit();
    private Resilience resilience = new Resilience();

    @Data
    public static class Store {
        /**
         * {@code redis} (default) or {@code local}.
         */
        @NotBlank
        private String type = "redis";
    }

    @Data
    public static class Signature {
        /**
         * Server-held HMAC secret. Requests are rejected with a configuration error while unset.
         */
        private String secret;

        @NotBlank
        private String header = "x-hookrelay-signature";

        @NotBlank
        private String timestampHeader = "x-hookrelay-request-timestamp";

        /**
         * Maximum allowed distance between the signed timestamp and server time.
         */
        @NotNull
        private Duration tolerance = Duration.ofMinutes(5);
    }

    @Data
    public static class Idempotency {
        /**
         * Lifetime of a dedup marker; should cover the platform's longest redelivery window.
         */
        @NotNull
        private Duration ttl = Duration.ofHours(1);

        @NotNull
        private StoreFailurePolicy storeFailurePolicy = StoreFailurePolicy.PROCESS;
    }

    @Data
    public static class Lock {
        @NotNull
        private Duration defaultTtl = Duration.ofSeconds(30);

        @Min(0)
        private int maxRetries = 20;

        @NotNull
        private Duration retryDelay = Duration.ofMillis(50);
    }

    @Data
    public static class RateLimit {
        /**
         * Lifetime of token bucket state after the last write.
         */
        @NotNull
        private Duration bucketTtl = Duration.ofHours(1);
    }

    @Data
    public static class Resilience {
        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 500;

        @Min(1)
        private int defaultMaxAttempts = 3;

        @NotNull
        private Duration defaultRetryDelay = Duration.ofSeconds(1);

        @Min(1)
        private int defaultFailureThreshold = 5;

        @NotNull
        private Duration defaultOpenTimeout = Duration.ofMinutes(1);
    }
}
