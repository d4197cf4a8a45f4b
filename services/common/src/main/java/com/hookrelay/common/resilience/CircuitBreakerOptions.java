package com.hookrelay.common.resilience;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Configuration for {@link ErrorRecoveryService#withCircuitBreaker}.
 */
@Data
@Builder(toBuilder = true)
public class CircuitBreakerOptions {

    @Builder.Default
    private int failureThreshold = 5;

    /**
     * How long the breaker stays OPEN after the last failure before allowing a trial call.
     */
    @Builder.Default
    private Duration openTimeout = Duration.ofMinutes(1);

    public static CircuitBreakerOptions defaults() {
        return CircuitBreakerOptions.builder().build();
    }
}
