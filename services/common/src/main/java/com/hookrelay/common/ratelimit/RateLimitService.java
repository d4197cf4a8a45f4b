package com.hookrelay.common.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.config.ResilienceExecutorConfiguration;
import com.hookrelay.common.exception.StoreUnavailableException;
import com.hookrelay.common.store.AtomicScript;
import com.hookrelay.common.store.AtomicStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Request admission against limits shared by every replica.
 *
 * <p>Four algorithms are available, selectable per call site:
 * <ul>
 *   <li>fixed window: counter per {@code windowMs} bucket aligned to the epoch</li>
 *   <li>sliding window log: timestamps of admitted requests within the trailing window</li>
 *   <li>token bucket: capacity refilled at a fixed rate, allows bursts</li>
 *   <li>exponential backoff: fixed window whose limit halves per recent violation</li>
 * </ul>
 *
 * <p>Every check fails open: when the store is unreachable the request is allowed, the decision
 * is logged at ERROR and counted on {@code hookrelay.ratelimit.fail_open}.
 *
 * <p>Sliding window and token bucket state is read and written in two steps. Concurrent requests
 * on the same key may both be admitted; they are approximate limits, not strict ones.
 */
@Slf4j
@Service
public class RateLimitService {

    private static final TypeReference<List<Long>> TIMESTAMPS = new TypeReference<>() { };
    private static final long FAIL_OPEN_BUCKET_RESET_MS = 60_000L;

    private final AtomicStore atomicStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor executor;
    private final long bucketTtlSeconds;

    private final Map<RateLimitAlgorithm, Counter> rejections = new EnumMap<>(RateLimitAlgorithm.class);
    private final Map<RateLimitAlgorithm, Counter> failOpens = new EnumMap<>(RateLimitAlgorithm.class);

    public RateLimitService(AtomicStore atomicStore,
                            ObjectMapper objectMapper,
                            Clock clock,
                            HookRelayProperties properties,
                            @Qualifier(ResilienceExecutorConfiguration.RESILIENCE_TASK_EXECUTOR) Executor executor,
                            MeterRegistry meterRegistry) {
        this.atomicStore = atomicStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.executor = executor;
        this.bucketTtlSeconds = properties.getRateLimit().getBucketTtl().getSeconds();

        for (RateLimitAlgorithm algorithm : RateLimitAlgorithm.values()) {
            rejections.put(algorithm, Counter.builder("hookrelay.ratelimit.rejections")
                    .description("Requests rejected by a rate limit")
                    .tag("algorithm", algorithm.name())
                    .register(meterRegistry));
            failOpens.put(algorithm, Counter.builder("hookrelay.ratelimit.fail_open")
                    .description("Rate-limit checks allowed because the store was unreachable")
                    .tag("algorithm", algorithm.name())
                    .register(meterRegistry));
        }
    }

    /**
     * Dispatches to the algorithm named in the request.
     */
    public RateLimitResult check(RateLimitRequest request) {
        switch (request.getAlgorithm()) {
            case SLIDING_WINDOW:
                return checkSlidingWindow(request.getKey(), request.getLimit(), request.getWindowMs());
            case TOKEN_BUCKET:
                return checkTokenBucket(request.getKey(), request.getLimit(), request.getRefillRate(),
                        request.getTokensRequested());
            case EXPONENTIAL_BACKOFF:
                return checkWithBackoff(request.getKey(), request.getLimit(), request.getWindowMs());
            case FIXED_WINDOW:
            default:
                return checkLimit(new RateLimitConfig(request.getKey(), request.getLimit(), request.getWindowMs()));
        }
    }

    /**
     * Fixed window. The window containing now is {@code [floor(now / windowMs) * windowMs, +windowMs)}.
     */
    public RateLimitResult checkLimit(RateLimitConfig config) {
        return checkFixedWindow(config, RateLimitAlgorithm.FIXED_WINDOW);
    }

    /**
     * Evaluates every limit in parallel and joins on all of them.
     *
     * @return the first rejection in input order, otherwise the result with the fewest remaining
     */
    public RateLimitResult checkMultipleLimits(List<RateLimitConfig> configs) {
        if (configs == null || configs.isEmpty()) {
            throw new IllegalArgumentException("at least one rate limit config is required");
        }
        List<CompletableFuture<RateLimitResult>> futures = new ArrayList<>(configs.size());
        for (RateLimitConfig config : configs) {
            futures.add(CompletableFuture.supplyAsync(() -> checkLimit(config), executor));
        }
        List<RateLimitResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        RateLimitResult mostRestrictive = results.get(0);
        for (RateLimitResult result : results) {
            if (!result.isAllowed()) {
                return result;
            }
            if (result.getRemaining() < mostRestrictive.getRemaining()) {
                mostRestrictive = result;
            }
        }
        return mostRestrictive;
    }

    /**
     * Sliding window log. Admits a request when fewer than {@code limit} requests were admitted in
     * {@code (now - windowMs, now]}.
     */
    public RateLimitResult checkSlidingWindow(String key, long limit, long windowMs) {
        requirePositive(limit, windowMs);
        long now = clock.millis();
        long windowStart = now - windowMs;
        String slidingKey = atomicStore.buildKey("sliding", key);

        try {
            List<Long> recent = readJson(slidingKey, TIMESTAMPS, new ArrayList<>());
            List<Long> valid = recent.stream()
                    .filter(timestamp -> timestamp > windowStart)
                    .collect(Collectors.toCollection(ArrayList::new));

            if (valid.size() >= limit) {
                long oldest = valid.stream().mapToLong(Long::longValue).min().orElse(now);
                long retryAfter = Math.max(1L, ceilSeconds(oldest + windowMs - now));
                rejections.get(RateLimitAlgorithm.SLIDING_WINDOW).increment();
                log.warn("Sliding window limit exceeded: key={}, limit={}, windowMs={}, retryAfter={}",
                        key, limit, windowMs, retryAfter);
                return RateLimitResult.builder()
                        .allowed(false)
                        .limit(limit)
                        .remaining(0)
                        .resetTime(Instant.ofEpochMilli(oldest + windowMs))
                        .retryAfter(retryAfter)
                        .build();
            }

            valid.add(now);
            atomicStore.set(slidingKey, writeJson(valid), Math.max(1L, ceilSeconds(windowMs)));

            return RateLimitResult.builder()
                    .allowed(true)
                    .limit(limit)
                    .remaining(limit - valid.size())
                    .resetTime(Instant.ofEpochMilli(now + windowMs))
                    .build();
        } catch (StoreUnavailableException e) {
            return failOpen(RateLimitAlgorithm.SLIDING_WINDOW, key, limit, limit - 1,
                    Instant.ofEpochMilli(now + windowMs), e);
        }
    }

    /**
     * Token bucket holding up to {@code capacity} tokens, refilled at {@code refillRate} tokens per
     * second. A new bucket starts full. Rejections leave the stored bucket untouched.
     */
    public RateLimitResult checkTokenBucket(String key, long capacity, double refillRate, long tokensRequested) {
        if (capacity < 1 || refillRate <= 0 || tokensRequested < 1) {
            throw new IllegalArgumentException("capacity, refillRate and tokensRequested must be positive");
        }
        long now = clock.millis();
        String bucketKey = atomicStore.buildKey("bucket", key);

        try {
            TokenBucketState bucket = readJson(bucketKey, TokenBucketState.class, new TokenBucketState(capacity, now));

            long elapsedMs = Math.max(0L, now - bucket.lastRefill());
            long tokensToAdd = (long) Math.floor(elapsedMs / 1000.0 * refillRate);
            long tokens = Math.min(capacity, bucket.tokens() + tokensToAdd);
            // credit only the time that produced whole tokens; a full bucket has nothing to carry over
            long lastRefill = tokens >= capacity
                    ? now
                    : bucket.lastRefill() + (long) Math.ceil(tokensToAdd * 1000.0 / refillRate);

            if (tokens < tokensRequested) {
                long waitSeconds = (long) Math.ceil((tokensRequested - tokens) / refillRate);
                rejections.get(RateLimitAlgorithm.TOKEN_BUCKET).increment();
                log.warn("Token bucket exhausted: key={}, capacity={}, tokens={}, requested={}, retryAfter={}",
                        key, capacity, tokens, tokensRequested, waitSeconds);
                return RateLimitResult.builder()
                        .allowed(false)
                        .limit(capacity)
                        .remaining(tokens)
                        .resetTime(Instant.ofEpochMilli(now + waitSeconds * 1000L))
                        .retryAfter(waitSeconds)
                        .build();
            }

            long remaining = tokens - tokensRequested;
            atomicStore.set(bucketKey, writeJson(new TokenBucketState(remaining, Math.min(lastRefill, now))),
                    bucketTtlSeconds);

            return RateLimitResult.builder()
                    .allowed(true)
                    .limit(capacity)
                    .remaining(remaining)
                    .resetTime(Instant.ofEpochMilli(now + (long) ((capacity - remaining) / refillRate * 1000)))
                    .build();
        } catch (StoreUnavailableException e) {
            return failOpen(RateLimitAlgorithm.TOKEN_BUCKET, key, capacity, capacity - tokensRequested,
                    Instant.ofEpochMilli(now + FAIL_OPEN_BUCKET_RESET_MS), e);
        }
    }

    /**
     * Fixed window whose limit is {@code max(1, floor(baseLimit / 2^violations))}. Each rejection
     * records another violation, remembered for {@code windowMs * 2^violations}.
     */
    public RateLimitResult checkWithBackoff(String key, long baseLimit, long windowMs) {
        requirePositive(baseLimit, windowMs);
        String violationKey = atomicStore.buildKey("backoff-violations", key);

        int violations;
        try {
            String stored = atomicStore.get(violationKey);
            violations = stored == null ? 0 : Integer.parseInt(stored);
        } catch (StoreUnavailableException e) {
            failOpens.get(RateLimitAlgorithm.EXPONENTIAL_BACKOFF).increment();
            log.error("Failed to read backoff violations, using base limit: key={}", key, e);
            violations = 0;
        } catch (NumberFormatException e) {
            log.warn("Corrupt backoff violation counter, using base limit: key={}", key);
            violations = 0;
        }

        // cap the shift; the limit bottoms out at 1 long before this
        int shift = Math.min(violations, 30);
        long adjustedLimit = Math.max(1L, baseLimit >> shift);

        RateLimitResult result = checkFixedWindow(
                new RateLimitConfig(atomicStore.buildKey("backoff", key), adjustedLimit, windowMs),
                RateLimitAlgorithm.EXPONENTIAL_BACKOFF);

        if (!result.isAllowed()) {
            long violationTtl = Math.max(1L, ceilSeconds(windowMs * (1L << shift)));
            try {
                atomicStore.set(violationKey, Integer.toString(violations + 1), violationTtl);
                log.warn("Rate limit violation recorded with backoff: key={}, violations={}, adjustedLimit={}, baseLimit={}",
                        key, violations + 1, adjustedLimit, baseLimit);
            } catch (StoreUnavailableException e) {
                log.error("Failed to record backoff violation: key={}", key, e);
            }
        }
        return result;
    }

    private RateLimitResult checkFixedWindow(RateLimitConfig config, RateLimitAlgorithm algorithm) {
        long now = clock.millis();
        long windowStart = Math.floorDiv(now, config.windowMs()) * config.windowMs();
        long windowEnd = windowStart + config.windowMs();
        Instant resetTime = Instant.ofEpochMilli(windowEnd);
        String bucketKey = atomicStore.buildKey("rate-limit", config.key(), windowStart);

        try {
            String stored = atomicStore.get(bucketKey);
            long current = stored == null ? 0L : Long.parseLong(stored);
            if (current >= config.limit()) {
                return reject(algorithm, config, resetTime, windowEnd - now);
            }

            long ttlSeconds = Math.max(1L, ceilSeconds(windowEnd - now));
            long newCount = atomicStore.executeScript(AtomicScript.INCREMENT_WITH_EXPIRY,
                    List.of(bucketKey), Long.toString(ttlSeconds));
            if (newCount > config.limit()) {
                // lost a race with another replica between the read and the increment
                return reject(algorithm, config, resetTime, windowEnd - now);
            }

            return RateLimitResult.builder()
                    .allowed(true)
                    .limit(config.limit())
                    .remaining(Math.max(0L, config.limit() - newCount))
                    .resetTime(resetTime)
                    .build();
        } catch (StoreUnavailableException e) {
            return failOpen(algorithm, config.key(), config.limit(), config.limit() - 1, resetTime, e);
        } catch (NumberFormatException e) {
            log.error("Corrupt rate limit counter, allowing request: key={}", config.key());
            failOpens.get(algorithm).increment();
            return allowedFallback(config.limit(), config.limit() - 1, resetTime);
        }
    }

    private RateLimitResult reject(RateLimitAlgorithm algorithm, RateLimitConfig config,
                                   Instant resetTime, long untilResetMs) {
        long retryAfter = ceilSeconds(untilResetMs);
        rejections.get(algorithm).increment();
        log.warn("Rate limit exceeded: key={}, limit={}, windowMs={}, retryAfter={}",
                config.key(), config.limit(), config.windowMs(), retryAfter);
        return RateLimitResult.builder()
                .allowed(false)
                .limit(config.limit())
                .remaining(0)
                .resetTime(resetTime)
                .retryAfter(retryAfter)
                .build();
    }

    private RateLimitResult failOpen(RateLimitAlgorithm algorithm, String key, long limit, long remaining,
                                     Instant resetTime, StoreUnavailableException e) {
        failOpens.get(algorithm).increment();
        log.error("Rate limit store unavailable, allowing request: algorithm={}, key={}", algorithm, key, e);
        return allowedFallback(limit, remaining, resetTime);
    }

    private static RateLimitResult allowedFallback(long limit, long remaining, Instant resetTime) {
        return RateLimitResult.builder()
                .allowed(true)
                .limit(limit)
                .remaining(Math.max(0L, remaining))
                .resetTime(resetTime)
                .build();
    }

    private <T> T readJson(String key, Class<T> type, T fallback) {
        String json = atomicStore.get(key);
        if (json == null) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable rate limit state: key={}", key);
            return fallback;
        }
    }

    private <T> T readJson(String key, TypeReference<T> type, T fallback) {
        String json = atomicStore.get(key);
        if (json == null) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable rate limit state: key={}", key);
            return fallback;
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rate limit state", e);
        }
    }

    private static long ceilSeconds(long millis) {
        return (long) Math.ceil(millis / 1000.0);
    }

    private static void requirePositive(long limit, long windowMs) {
        if (limit < 1 || windowMs < 1) {
            throw new IllegalArgumentException("limit and windowMs must be positive");
        }
    }
}
