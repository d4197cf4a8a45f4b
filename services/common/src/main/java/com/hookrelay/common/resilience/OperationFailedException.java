package com.hookrelay.common.resilience;

/**
 * Carries a checked exception thrown by a wrapped operation. Unchecked exceptions
 * pass through the executor unchanged.
 */
public class OperationFailedException extends RuntimeException {

    public OperationFailedException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
