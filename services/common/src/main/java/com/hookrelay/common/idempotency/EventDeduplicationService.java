package com.hookrelay.common.idempotency;

import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.exception.StoreUnavailableException;
import com.hookrelay.common.store.AtomicStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Suppresses reprocessing of events the platform delivers more than once.
 *
 * <p>{@link #checkAndMark(String)} performs an atomic set-if-not-exists on a presence marker, so
 * exactly one delivery per TTL window sees {@code false}. Callers must acknowledge duplicates
 * successfully; answering them with an error would trigger further redelivery.
 *
 * <p>Behaviour while the store is unreachable is governed by {@link StoreFailurePolicy}.
 */
@Slf4j
@Service
public class EventDeduplicationService {

    static final String KEY_NAMESPACE = "dedup";
    private static final String MARKER = "1";

    private final AtomicStore atomicStore;
    private final Duration ttl;
    private final StoreFailurePolicy failurePolicy;

    private final Counter duplicates;
    private final Counter storeFailures;

    public EventDeduplicationService(AtomicStore atomicStore,
                                     HookRelayProperties properties,
                                     MeterRegistry meterRegistry) {
        this.atomicStore = atomicStore;
        this.ttl = properties.getIdempotency().getTtl();
        this.failurePolicy = properties.getIdempotency().getStoreFailurePolicy();

        this.duplicates = Counter.builder("hookrelay.dedup.duplicates")
                .description("Redelivered events suppressed by the deduplication filter")
                .register(meterRegistry);
        this.storeFailures = Counter.builder("hookrelay.dedup.store.failures")
                .description("Deduplication checks that could not reach the shared store")
                .tag("policy", failurePolicy.name())
                .register(meterRegistry);
    }

    /**
     * Atomically checks for and records the event id.
     *
     * @param eventId platform event identifier
     * @return true if the event was already seen within the TTL window
     * @throws StoreUnavailableException if the store is down and the policy is {@link StoreFailurePolicy#REJECT}
     */
    public boolean checkAndMark(String eventId) {
        String key = buildKey(eventId);
        try {
            boolean created = atomicStore.setIfNotExists(key, MARKER, ttl.getSeconds());
            if (created) {
                log.debug("Event marked as processed: eventId={}", eventId);
                return false;
            }
            duplicates.increment();
            log.warn("Duplicate event detected: eventId={}", eventId);
            return true;
        } catch (StoreUnavailableException e) {
            storeFailures.increment();
            if (failurePolicy == StoreFailurePolicy.REJECT) {
                log.error("Dedup store unavailable, rejecting event for redelivery: eventId={}", eventId, e);
                throw e;
            }
            log.error("Dedup store unavailable, processing event WITHOUT duplicate suppression: eventId={}",
                    eventId, e);
            return false;
        }
    }

    /**
     * Whether a marker exists for the event. Read-only; returns false when the store is unreachable.
     */
    public boolean isProcessed(String eventId) {
        try {
            return atomicStore.exists(buildKey(eventId));
        } catch (StoreUnavailableException e) {
            storeFailures.increment();
            log.error("Failed to check event marker: eventId={}", eventId, e);
            return false;
        }
    }

    /**
     * Unconditionally records the event, refreshing the TTL. Best effort.
     */
    public void markAsProcessed(String eventId) {
        try {
            atomicStore.set(buildKey(eventId), MARKER, ttl.getSeconds());
            log.debug("Event marked as processed: eventId={}", eventId);
        } catch (StoreUnavailableException e) {
            storeFailures.increment();
            log.error("Failed to mark event as processed: eventId={}", eventId, e);
        }
    }

    /**
     * Removes the marker so a later redelivery is processed again, e.g. after the handler failed.
     * Best effort.
     */
    public void clearEvent(String eventId) {
        try {
            atomicStore.delete(buildKey(eventId));
            log.debug("Event cleared from deduplication cache: eventId={}", eventId);
        } catch (StoreUnavailableException e) {
            storeFailures.increment();
            log.error("Failed to clear event from deduplication cache: eventId={}", eventId, e);
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    public StoreFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    private String buildKey(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId must not be blank");
        }
        return atomicStore.buildKey(KEY_NAMESPACE, eventId);
    }
}
