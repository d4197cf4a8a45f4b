package com.hookrelay.common.store;

import com.hookrelay.common.exception.StoreUnavailableException;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Key-value store shared by every replica. All cross-instance coordination
 * (locks, rate limits, deduplication) goes through this contract.
 *
 * <p>Every write carries a TTL. Implementations report infrastructure failures
 * as {@link StoreUnavailableException}; callers choose their own policy.
 */
public interface AtomicStore {

    @Nullable
    String get(String key);

    void set(String key, String value, long ttlSeconds);

    /**
     * Atomically writes the value when the key is absent.
     *
     * @return true if this call created the key
     */
    boolean setIfNotExists(String key, String value, long ttlSeconds);

    /**
     * Runs one of the predefined compare-and-act scripts atomically.
     */
    long executeScript(AtomicScript script, List<String> keys, String... args);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * Builds a namespaced key, e.g. {@code buildKey("rate-limit", "team-1", 1700000000000L)}
     * gives {@code rate-limit:team-1:1700000000000}.
     */
    default String buildKey(String namespace, Object... parts) {
        if (parts.length == 0) {
            return namespace;
        }
        return namespace + ":" + Arrays.stream(parts)
                .map(String::valueOf)
                .collect(Collectors.joining(":"));
    }

    static void requireTtl(long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive (current: " + ttlSeconds + ")");
        }
    }
}
