package com.hookrelay.common.exception;

import com.hookrelay.common.ratelimit.RateLimitResult;
import lombok.Getter;

/**
 * Raised by the HTTP layer when a {@link RateLimitResult} rejects a request.
 * The limiter itself never throws; it returns a result.
 */
@Getter
public class RateLimitExceededException extends HookRelayException {

    private final long retryAfterSeconds;
    private final long limit;
    private final long remaining;
    private final long resetEpochSeconds;

    public RateLimitExceededException(String message, RateLimitResult result) {
        super(ErrorCode.RATE_LIMITED, message);
        this.retryAfterSeconds = result.getRetryAfter() != null ? result.getRetryAfter() : 0L;
        this.limit = result.getLimit();
        this.remaining = result.getRemaining();
        this.resetEpochSeconds = result.getResetTime().getEpochSecond();
    }
}
