package com.hookrelay.webhook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.config.ResilienceExecutorConfiguration;
import com.hookrelay.common.distributed.DistributedLockService;
import com.hookrelay.common.idempotency.EventDeduplicationService;
import com.hookrelay.common.ratelimit.RateLimitConfig;
import com.hookrelay.common.ratelimit.RateLimitResult;
import com.hookrelay.common.ratelimit.RateLimitService;
import com.hookrelay.common.store.LocalAtomicStore;
import com.hookrelay.webhook.client.NotificationClient;
import com.hookrelay.webhook.client.NotificationOutcome;
import com.hookrelay.webhook.model.WebhookEvent;
import com.hookrelay.webhook.processor.WebhookEventProcessor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("WebhookProcessingConfiguration Tests")
class WebhookProcessingConfigurationTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private ThreadPoolTaskExecutor processingExecutor;
    private ThreadPoolTaskExecutor resilienceExecutor;
    private WebhookEventProcessor processor;
    private RateLimitService rateLimitService;

    @BeforeEach
    void setUp() {
        HookRelayProperties properties = new HookRelayProperties();
        WebhookProperties webhookProperties = new WebhookProperties();
        webhookProperties.getProcessing().setCorePoolSize(2);
        webhookProperties.getProcessing().setMaxPoolSize(2);
        webhookProperties.getProcessing().setQueueCapacity(1);

        processingExecutor = new WebhookProcessingConfiguration().webhookProcessingExecutor(webhookProperties);
        resilienceExecutor = new ResilienceExecutorConfiguration().resilienceTaskExecutor(properties);

        LocalAtomicStore store = new LocalAtomicStore(Clock.systemUTC());
        NotificationClient notificationClient = mock(NotificationClient.class);
        when(notificationClient.send(any())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return NotificationOutcome.SENT;
        });

        processor = new WebhookEventProcessor(
                new DistributedLockService(store, properties, duration -> { }, meterRegistry),
                new EventDeduplicationService(store, properties, meterRegistry),
                notificationClient, webhookProperties, processingExecutor, meterRegistry);
        rateLimitService = new RateLimitService(store, new ObjectMapper(), Clock.systemUTC(), properties,
                resilienceExecutor, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        processingExecutor.shutdown();
        resilienceExecutor.shutdown();
    }

    @Test
    @DisplayName("Should answer rate-limit checks while every processing thread is blocked")
    void shouldCheckLimitsWhileProcessingSaturated() {
        for (int i = 0; i < 3; i++) {
            processor.submit(new WebhookEvent("Ev" + i, "T" + i, "message", null));
        }
        assertThatThrownBy(() -> processor.submit(new WebhookEvent("Ev9", "T9", "message", null)))
                .isInstanceOf(RejectedExecutionException.class);

        RateLimitResult result = assertTimeoutPreemptively(Duration.ofSeconds(3), () ->
                rateLimitService.checkMultipleLimits(List.of(
                        new RateLimitConfig("team:T1", 300, 60_000L),
                        new RateLimitConfig("ip:10.0.0.1", 600, 60_000L))));

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getRemaining()).isEqualTo(299);
    }

    @Test
    @DisplayName("Should keep the processing pool separate from the resilience pool")
    void shouldUseDedicatedThreads() {
        assertThat(processingExecutor).isNotSameAs(resilienceExecutor);
        assertThat(processingExecutor.getThreadNamePrefix()).isEqualTo("webhook-processing-");
    }
}
