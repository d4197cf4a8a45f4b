package com.hookrelay.common.ratelimit;

/**
 * Fixed-window limit: at most {@code limit} requests per {@code windowMs} for {@code key}.
 */
public record RateLimitConfig(String key, long limit, long windowMs) {

    public RateLimitConfig {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        if (windowMs < 1) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
    }
}
