package com.hookrelay.common.ratelimit;

import lombok.Builder;
import lombok.Data;

/**
 * Algorithm-agnostic check request for {@link RateLimitService#check(RateLimitRequest)}.
 *
 * <p>For {@link RateLimitAlgorithm#TOKEN_BUCKET}, {@code limit} is the bucket capacity and
 * {@code windowMs} is ignored in favour of {@code refillRate}. The other algorithms ignore
 * {@code refillRate} and {@code tokensRequested}.
 */
@Data
@Builder
public class RateLimitRequest {

    @Builder.Default
    private RateLimitAlgorithm algorithm = RateLimitAlgorithm.FIXED_WINDOW;

    private String key;

    private long limit;

    private long windowMs;

    /**
     * Tokens added per second.
     */
    private double refillRate;

    @Builder.Default
    private long tokensRequested = 1;
}
