package com.hookrelay.common.store;

/**
 * The closed set of compare-and-act operations the shared store must execute atomically.
 *
 * <p>Every script takes the target key as {@code KEYS[1]} and returns an integer.
 */
public enum AtomicScript {

    /**
     * Deletes the key only when its value equals {@code ARGV[1]}. Returns 1 when deleted, 0 otherwise.
     */
    COMPARE_AND_DELETE("""
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            return redis.call('DEL', KEYS[1])
        else
            return 0
        end
        """),

    /**
     * Resets the TTL to {@code ARGV[2]} seconds only when the value equals {@code ARGV[1]}.
     * Returns 1 when extended, 0 otherwise.
     */
    COMPARE_AND_EXPIRE("""
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            return redis.call('EXPIRE', KEYS[1], ARGV[2])
        else
            return 0
        end
        """),

    /**
     * Increments the counter and sets a TTL of {@code ARGV[1]} seconds when the
     * counter was just created. Returns the new count.
     */
    INCREMENT_WITH_EXPIRY("""
        local current = redis.call('INCR', KEYS[1])
        if current == 1 then
            redis.call('EXPIRE', KEYS[1], ARGV[1])
        end
        return current
        """);

    private final String lua;

    AtomicScript(String lua) {
        this.lua = lua;
    }

    public String getLua() {
        return lua;
    }
}
