package com.hookrelay.common.ratelimit;

public enum RateLimitAlgorithm {
    FIXED_WINDOW,
    SLIDING_WINDOW,
    TOKEN_BUCKET,
    EXPONENTIAL_BACKOFF
}
