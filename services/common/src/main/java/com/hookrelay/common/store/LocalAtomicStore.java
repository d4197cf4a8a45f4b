package com.hookrelay.common.store;

import com.hookrelay.common.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Single-process {@link AtomicStore} for local development, single-replica
 * deployments and tests. Provides no coordination across processes.
 *
 * <p>All operations synchronize on the store, which makes every script atomic.
 * Expired entries are dropped on access and swept once the table grows past
 * {@link #SWEEP_THRESHOLD}.
 */
@Slf4j
public class LocalAtomicStore implements AtomicStore {

    private static final int SWEEP_THRESHOLD = 10_000;

    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();

    public LocalAtomicStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized String get(String key) {
        Entry entry = live(key);
        return entry != null ? entry.value : null;
    }

    @Override
    public synchronized void set(String key, String value, long ttlSeconds) {
        AtomicStore.requireTtl(ttlSeconds);
        put(key, value, ttlSeconds);
    }

    @Override
    public synchronized boolean setIfNotExists(String key, String value, long ttlSeconds) {
        AtomicStore.requireTtl(ttlSeconds);
        if (live(key) != null) {
            return false;
        }
        put(key, value, ttlSeconds);
        return true;
    }

    @Override
    public synchronized long executeScript(AtomicScript script, List<String> keys, String... args) {
        String key = keys.get(0);
        Entry entry = live(key);
        switch (script) {
            case COMPARE_AND_DELETE:
                if (entry != null && entry.value.equals(args[0])) {
                    entries.remove(key);
                    return 1L;
                }
                return 0L;
            case COMPARE_AND_EXPIRE:
                if (entry != null && entry.value.equals(args[0])) {
                    entry.expiresAtMillis = expiry(Long.parseLong(args[1]));
                    return 1L;
                }
                return 0L;
            case INCREMENT_WITH_EXPIRY:
                if (entry == null) {
                    put(key, "1", Long.parseLong(args[0]));
                    return 1L;
                }
                try {
                    long next = Long.parseLong(entry.value) + 1;
                    entry.value = Long.toString(next);
                    return next;
                } catch (NumberFormatException e) {
                    throw new StoreUnavailableException("Value at " + key + " is not an integer", e);
                }
            default:
                throw new IllegalArgumentException("Unsupported script: " + script);
        }
    }

    @Override
    public synchronized boolean delete(String key) {
        return live(key) != null && entries.remove(key) != null;
    }

    @Override
    public synchronized boolean exists(String key) {
        return live(key) != null;
    }

    /**
     * Remaining TTL in seconds, or -2 when the key does not exist (Redis TTL semantics).
     */
    public synchronized long ttlSeconds(String key) {
        Entry entry = live(key);
        if (entry == null) {
            return -2L;
        }
        long remainingMillis = entry.expiresAtMillis - clock.millis();
        return (remainingMillis + 999) / 1000;
    }

    public synchronized int size() {
        sweep();
        return entries.size();
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry != null && entry.expiresAtMillis <= clock.millis()) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void put(String key, String value, long ttlSeconds) {
        entries.put(key, new Entry(value, expiry(ttlSeconds)));
        if (entries.size() > SWEEP_THRESHOLD) {
            sweep();
        }
    }

    private long expiry(long ttlSeconds) {
        return clock.millis() + ttlSeconds * 1000L;
    }

    private void sweep() {
        long now = clock.millis();
        int removed = 0;
        for (Iterator<Entry> it = entries.values().iterator(); it.hasNext(); ) {
            if (it.next().expiresAtMillis <= now) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired entries from local store", removed);
        }
    }

    private static final class Entry {
        private String value;
        private long expiresAtMillis;

        private Entry(String value, long expiresAtMillis) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }
    }
}
