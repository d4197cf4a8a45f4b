package com.hookrelay.common.resilience;

import java.time.Instant;

/**
 * Mutable breaker state for one protected operation key. Guarded by its own monitor;
 * only {@link ErrorRecoveryService} mutates it.
 */
final class CircuitState {

    private final String key;
    private int consecutiveFailures;
    private long lastFailureTimestamp;
    private CircuitPhase phase = CircuitPhase.CLOSED;
    private boolean trialInFlight;

    CircuitState(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    int consecutiveFailures() {
        return consecutiveFailures;
    }

    long lastFailureTimestamp() {
        return lastFailureTimestamp;
    }

    CircuitPhase phase() {
        return phase;
    }

    boolean trialInFlight() {
        return trialInFlight;
    }

    void startTrial() {
        phase = CircuitPhase.HALF_OPEN;
        trialInFlight = true;
    }

    void recordFailure(long timestamp) {
        consecutiveFailures++;
        lastFailureTimestamp = timestamp;
        trialInFlight = false;
    }

    void open() {
        phase = CircuitPhase.OPEN;
    }

    void close() {
        phase = CircuitPhase.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
    }

    void reset() {
        close();
        lastFailureTimestamp = 0L;
    }

    CircuitStatus snapshot() {
        return new CircuitStatus(key, consecutiveFailures,
                lastFailureTimestamp > 0 ? Instant.ofEpochMilli(lastFailureTimestamp) : null, phase);
    }
}
