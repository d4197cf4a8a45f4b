package com.hookrelay.common.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.UUID;

/**
 * Reports the shared store as DOWN when a set/get round trip fails.
 * Locks and deduplication degrade while it is down; rate limiting fails open.
 */
@Slf4j
@RequiredArgsConstructor
public class AtomicStoreHealthIndicator implements HealthIndicator {

    private static final String PROBE_NAMESPACE = "health-probe";
    private static final long PROBE_TTL_SECONDS = 10;

    private final AtomicStore atomicStore;

    @Override
    public Health health() {
        String key = atomicStore.buildKey(PROBE_NAMESPACE, UUID.randomUUID());
        String value = Long.toString(System.nanoTime());
        long start = System.nanoTime();
        try {
            atomicStore.set(key, value, PROBE_TTL_SECONDS);
            String read = atomicStore.get(key);
            atomicStore.delete(key);
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            if (!value.equals(read)) {
                return Health.down()
                        .withDetail("store", atomicStore.getClass().getSimpleName())
                        .withDetail("reason", "probe value mismatch")
                        .build();
            }
            return Health.up()
                    .withDetail("store", atomicStore.getClass().getSimpleName())
                    .withDetail("latencyMs", latencyMs)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Atomic store health probe failed: {}", e.getMessage());
            return Health.down(e)
                    .withDetail("store", atomicStore.getClass().getSimpleName())
                    .build();
        }
    }
}
