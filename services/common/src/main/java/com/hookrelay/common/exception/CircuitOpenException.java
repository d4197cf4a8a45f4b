package com.hookrelay.common.exception;

/**
 * Exception thrown when a circuit breaker is open and the call was rejected
 * without invoking the downstream operation.
 */
public class CircuitOpenException extends HookRelayException {

    private final String circuitKey;

    public CircuitOpenException(String circuitKey) {
        super(ErrorCode.CIRCUIT_OPEN, String.format("Circuit breaker %s is OPEN", circuitKey));
        this.circuitKey = circuitKey;
    }

    public String getCircuitKey() {
        return circuitKey;
    }
}
