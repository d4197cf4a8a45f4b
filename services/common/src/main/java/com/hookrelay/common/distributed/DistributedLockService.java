package com.hookrelay.common.distributed;

import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.exception.LockAcquisitionTimeoutException;
import com.hookrelay.common.exception.StoreUnavailableException;
import com.hookrelay.common.resilience.GuardedResult;
import com.hookrelay.common.resilience.Sleeper;
import com.hookrelay.common.store.AtomicScript;
import com.hookrelay.common.store.AtomicStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Supplier;

/**
 * Cross-replica mutual exclusion on top of the shared store.
 *
 * <p>A lock is a store entry holding a random holder token and a TTL. Only the holder of the
 * token can release or extend it; both go through compare-and-act scripts so a holder whose TTL
 * lapsed cannot remove a lock someone else has since taken.
 *
 * <p>The TTL bounds how long a crashed holder blocks others. It is not a lease: a holder that
 * outlives its TTL loses exclusivity silently, so pick a TTL well above the critical section or
 * call {@link #extend}.
 */
@Slf4j
@Service
public class DistributedLockService {

    static final String KEY_NAMESPACE = "distributed-lock";
    private static final int TOKEN_BYTES = 16;

    private final SecureRandom random = new SecureRandom();
    private final AtomicStore atomicStore;
    private final Sleeper sleeper;
    private final Duration defaultTtl;
    private final int defaultMaxRetries;
    private final Duration retryDelay;
    private final Counter lockTimeouts;

    public DistributedLockService(AtomicStore atomicStore,
                                  HookRelayProperties properties,
                                  Sleeper sleeper,
                                  MeterRegistry meterRegistry) {
        this.atomicStore = atomicStore;
        this.sleeper = sleeper;
        this.defaultTtl = properties.getLock().getDefaultTtl();
        this.defaultMaxRetries = properties.getLock().getMaxRetries();
        this.retryDelay = properties.getLock().getRetryDelay();
        this.lockTimeouts = Counter.builder("hookrelay.lock.timeouts")
                .description("Lock acquisitions that exhausted their retries")
                .register(meterRegistry);
    }

    public String acquire(String key) {
        return acquire(key, defaultTtl, defaultMaxRetries);
    }

    /**
     * Acquires the lock, polling at the configured retry delay.
     *
     * @param ttl        lifetime of the lock record
     * @param maxRetries retries after the first attempt
     * @return holder token to pass to {@link #release} and {@link #extend}
     * @throws LockAcquisitionTimeoutException after {@code maxRetries + 1} failed attempts
     * @throws StoreUnavailableException       if the store is unreachable
     */
    public String acquire(String key, Duration ttl, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        String lockKey = lockKey(key);
        String token = newToken();
        long ttlSeconds = ttlSeconds(ttl);
        int attempts = maxRetries + 1;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (atomicStore.setIfNotExists(lockKey, token, ttlSeconds)) {
                log.debug("Lock acquired: key={}, attempt={}, ttlSeconds={}", key, attempt, ttlSeconds);
                return token;
            }
            if (attempt < attempts) {
                pause(key, attempt);
            }
        }

        lockTimeouts.increment();
        log.warn("Failed to acquire lock: key={}, attempts={}", key, attempts);
        throw new LockAcquisitionTimeoutException(key, attempts);
    }

    /**
     * Releases the lock if {@code token} still holds it. Never throws.
     *
     * @return false if the lock had expired, was held by someone else, or the store failed
     */
    public boolean release(String key, String token) {
        try {
            long released = atomicStore.executeScript(AtomicScript.COMPARE_AND_DELETE, List.of(lockKey(key)), token);
            if (released == 1L) {
                log.debug("Lock released: key={}", key);
                return true;
            }
            log.warn("Lock not released, not held by this token or expired: key={}", key);
            return false;
        } catch (RuntimeException e) {
            log.error("Error releasing lock: key={}", key, e);
            return false;
        }
    }

    /**
     * Resets the lock's TTL if {@code token} still holds it. Never throws.
     */
    public boolean extend(String key, String token, Duration ttl) {
        try {
            long extended = atomicStore.executeScript(AtomicScript.COMPARE_AND_EXPIRE, List.of(lockKey(key)),
                    token, Long.toString(ttlSeconds(ttl)));
            if (extended == 1L) {
                log.debug("Lock extended: key={}, ttlSeconds={}", key, ttl.getSeconds());
                return true;
            }
            log.warn("Lock not extended, not held by this token or expired: key={}", key);
            return false;
        } catch (RuntimeException e) {
            log.error("Error extending lock: key={}", key, e);
            return false;
        }
    }

    public boolean isLocked(String key) {
        return atomicStore.exists(lockKey(key));
    }

    public <T> T withLock(String key, Supplier<T> action) {
        return withLock(key, action, defaultTtl);
    }

    /**
     * Runs {@code action} while holding the lock. The lock is released on every exit path.
     */
    public <T> T withLock(String key, Supplier<T> action, Duration ttl) {
        String token = acquire(key, ttl, defaultMaxRetries);
        try {
            return action.get();
        } finally {
            release(key, token);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        }, defaultTtl);
    }

    public <T> GuardedResult<T> tryWithLock(String key, Supplier<T> action) {
        return tryWithLock(key, action, defaultTtl, defaultMaxRetries);
    }

    /**
     * Like {@link #withLock}, reporting contention and failures as a {@link GuardedResult}.
     */
    public <T> GuardedResult<T> tryWithLock(String key, Supplier<T> action, Duration ttl, int maxRetries) {
        String token;
        try {
            token = acquire(key, ttl, maxRetries);
        } catch (LockAcquisitionTimeoutException e) {
            return GuardedResult.lockTimeout(e.getLockKey());
        } catch (StoreUnavailableException e) {
            return GuardedResult.failed(e);
        }
        try {
            return GuardedResult.ok(action.get());
        } catch (RuntimeException e) {
            return GuardedResult.failed(e);
        } finally {
            release(key, token);
        }
    }

    private void pause(String key, int attempt) {
        try {
            sleeper.sleep(retryDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for lock: key={}, attempt={}", key, attempt);
            throw new LockAcquisitionTimeoutException(key, attempt);
        }
    }

    private String lockKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("lock key must not be blank");
        }
        return atomicStore.buildKey(KEY_NAMESPACE, key);
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static long ttlSeconds(Duration ttl) {
        long seconds = ttl.getSeconds();
        AtomicStore.requireTtl(seconds);
        return seconds;
    }
}
