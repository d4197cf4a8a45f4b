package com.hookrelay.common.ratelimit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Decision of a rate-limit check. A rejection is a normal result, not an error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitResult {

    private boolean allowed;
    private long limit;
    private long remaining;
    private Instant resetTime;

    /**
     * Seconds the caller should wait; set only on rejection.
     */
    private Long retryAfter;
}
