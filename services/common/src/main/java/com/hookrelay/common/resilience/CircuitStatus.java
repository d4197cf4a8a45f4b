package com.hookrelay.common.resilience;

import java.time.Instant;

/**
 * Point-in-time view of a circuit breaker, for monitoring.
 *
 * @param lastFailureTimestamp null when the breaker has never failed or was reset
 */
public record CircuitStatus(String key, int consecutiveFailures, Instant lastFailureTimestamp, CircuitPhase phase) {
}
