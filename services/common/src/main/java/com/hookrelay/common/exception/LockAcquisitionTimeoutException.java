package com.hookrelay.common.exception;

/**
 * Exception thrown when a distributed lock could not be acquired within the
 * configured number of attempts.
 */
public class LockAcquisitionTimeoutException extends HookRelayException {

    private final String lockKey;
    private final int attempts;

    public LockAcquisitionTimeoutException(String lockKey, int attempts) {
        super(ErrorCode.LOCK_ACQUISITION_TIMEOUT,
                String.format("Failed to acquire lock '%s' after %d attempts", lockKey, attempts));
        this.lockKey = lockKey;
        this.attempts = attempts;
    }

    public String getLockKey() {
        return lockKey;
    }

    public int getAttempts() {
        return attempts;
    }
}
