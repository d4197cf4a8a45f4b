package com.hookrelay.webhook.client;

import com.hookrelay.common.ratelimit.RateLimitResult;
import com.hookrelay.common.ratelimit.RateLimitService;
import com.hookrelay.common.resilience.CircuitBreakerOptions;
import com.hookrelay.common.resilience.ErrorRecoveryService;
import com.hookrelay.common.resilience.GuardedResult;
import com.hookrelay.common.resilience.RetryOptions;
import com.hookrelay.webhook.config.WebhookProperties;
import com.hookrelay.webhook.model.WebhookEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relays accepted events to the downstream notification endpoint.
 *
 * <p>Calls are shaped by a token bucket per downstream host, retried on transient failures and
 * guarded by a circuit breaker keyed {@code notify:<host>}. Notifications are non-critical: when
 * the bucket is empty or the circuit is open the notification is skipped, not queued.
 */
@Slf4j
@Component
public class NotificationClient {

    private final RestTemplate restTemplate;
    private final RateLimitService rateLimitService;
    private final ErrorRecoveryService errorRecoveryService;
    private final WebhookProperties.Notification config;
    private final RetryOptions retryOptions;
    private final CircuitBreakerOptions breakerOptions;

    public NotificationClient(RestTemplate notificationRestTemplate,
                              RateLimitService rateLimitService,
                              ErrorRecoveryService errorRecoveryService,
                              WebhookProperties properties) {
        this.restTemplate = notificationRestTemplate;
        this.rateLimitService = rateLimitService;
        this.errorRecoveryService = errorRecoveryService;
        this.config = properties.getNotification();
        this.retryOptions = RetryOptions.builder()
                .maxAttempts(config.getMaxAttempts())
                .delay(config.getRetryDelay())
                .build();
        this.breakerOptions = CircuitBreakerOptions.builder()
                .failureThreshold(config.getFailureThreshold())
                .openTimeout(config.getOpenTimeout())
                .build();
    }

    /**
     * @throws RuntimeException if delivery failed after retries
     */
    public NotificationOutcome send(WebhookEvent event) {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            log.debug("Notification endpoint not configured, skipping: eventId={}", event.eventId());
            return NotificationOutcome.DISABLED;
        }

        String host = URI.create(config.getUrl()).getHost();
        String circuitKey = "notify:" + host;

        RateLimitResult budget = rateLimitService.checkTokenBucket(
                circuitKey, config.getBurstCapacity(), config.getRefillPerSecond(), 1);
        if (!budget.isAllowed()) {
            log.warn("Notification budget exhausted, skipping: eventId={}, host={}, retryAfter={}",
                    event.eventId(), host, budget.getRetryAfter());
            return NotificationOutcome.SKIPPED_RATE_LIMITED;
        }

        GuardedResult<ResponseEntity<String>> result = errorRecoveryService.executeGuarded(circuitKey,
                () -> restTemplate.postForEntity(config.getUrl(), body(event), String.class),
                retryOptions, breakerOptions);

        switch (result.getStatus()) {
            case OK:
                log.info("Notification sent: eventId={}, host={}, status={}",
                        event.eventId(), host, result.getValue().getStatusCode().value());
                return NotificationOutcome.SENT;
            case CIRCUIT_OPEN:
                log.warn("Notification skipped, circuit open: eventId={}, circuit={}", event.eventId(), result.getKey());
                return NotificationOutcome.SKIPPED_CIRCUIT_OPEN;
            default:
                log.error("Notification failed: eventId={}, host={}, error={}",
                        event.eventId(), host, result.getError().getMessage());
                throw result.getError();
        }
    }

    private static Map<String, Object> body(WebhookEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event_id", event.eventId());
        body.put("team_id", event.teamId());
        body.put("event_type", event.eventType());
        body.put("event", event.payload());
        return body;
    }
}
