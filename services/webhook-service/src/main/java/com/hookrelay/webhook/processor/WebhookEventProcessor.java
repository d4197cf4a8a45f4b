package com.hookrelay.webhook.processor;

import com.hookrelay.common.distributed.DistributedLockService;
import com.hookrelay.common.idempotency.EventDeduplicationService;
import com.hookrelay.common.resilience.GuardedResult;
import com.hookrelay.webhook.client.NotificationClient;
import com.hookrelay.webhook.client.NotificationOutcome;
import com.hookrelay.webhook.config.WebhookProcessingConfiguration;
import com.hookrelay.webhook.config.WebhookProperties;
import com.hookrelay.webhook.model.WebhookEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Processes accepted events one team at a time across all replicas.
 *
 * <p>Events run after the platform has been acknowledged, so a failed event is not redelivered.
 * Every event that does not complete is logged at ERROR as dropped and counted on
 * {@code hookrelay.webhook.events.dropped}, tagged with the reason. Its dedup marker is cleared so
 * a later delivery of the same event id is processed rather than suppressed.
 */
@Slf4j
@Service
public class WebhookEventProcessor {

    static final String DROPPED_METRIC = "hookrelay.webhook.events.dropped";

    private final DistributedLockService lockService;
    private final EventDeduplicationService deduplicationService;
    private final NotificationClient notificationClient;
    private final WebhookProperties.Inbound config;
    private final Executor executor;

    private final Counter droppedLockTimeout;
    private final Counter droppedFailed;

    public WebhookEventProcessor(DistributedLockService lockService,
                                 EventDeduplicationService deduplicationService,
                                 NotificationClient notificationClient,
                                 WebhookProperties properties,
                                 @Qualifier(WebhookProcessingConfiguration.WEBHOOK_PROCESSING_EXECUTOR) Executor executor,
                                 MeterRegistry meterRegistry) {
        this.lockService = lockService;
        this.deduplicationService = deduplicationService;
        this.notificationClient = notificationClient;
        this.config = properties.getInbound();
        this.executor = executor;
        this.droppedLockTimeout = droppedCounter(meterRegistry, "lock_timeout");
        this.droppedFailed = droppedCounter(meterRegistry, "failed");
    }

    /**
     * Hands the event to the processing pool.
     *
     * @throws RejectedExecutionException when the processing queue is full; nothing was scheduled
     */
    public CompletableFuture<GuardedResult<NotificationOutcome>> submit(WebhookEvent event) {
        CompletableFuture<GuardedResult<NotificationOutcome>> future =
                CompletableFuture.supplyAsync(() -> process(event), executor);
        future.whenComplete((result, error) -> {
            if (error != null) {
                drop(event, droppedFailed, "unexpected error", error);
            }
        });
        return future;
    }

    public GuardedResult<NotificationOutcome> process(WebhookEvent event) {
        GuardedResult<NotificationOutcome> result = lockService.tryWithLock("team:" + event.teamId(),
                () -> notificationClient.send(event), config.getTeamLockTtl(), config.getTeamLockRetries());

        switch (result.getStatus()) {
            case OK:
                log.debug("Event processed: eventId={}, outcome={}", event.eventId(), result.getValue());
                break;
            case LOCK_TIMEOUT:
                drop(event, droppedLockTimeout, "team lock " + result.getKey() + " busy", null);
                break;
            default:
                drop(event, droppedFailed, "processing failed", result.getError());
                break;
        }
        return result;
    }

    private void drop(WebhookEvent event, Counter counter, String reason, Throwable error) {
        counter.increment();
        log.error("Event dropped: eventId={}, teamId={}, reason={}", event.eventId(), event.teamId(), reason, error);
        deduplicationService.clearEvent(event.eventId());
    }

    private static Counter droppedCounter(MeterRegistry meterRegistry, String reason) {
        return Counter.builder(DROPPED_METRIC)
                .description("Accepted webhook events that were not processed")
                .tag("reason", reason)
                .register(meterRegistry);
    }
}
