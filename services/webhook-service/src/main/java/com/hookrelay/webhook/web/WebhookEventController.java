package com.hookrelay.webhook.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.hookrelay.common.exception.ProcessingBacklogFullException;
import com.hookrelay.common.exception.RateLimitExceededException;
import com.hookrelay.common.exception.WebhookValidationException;
import com.hookrelay.common.idempotency.EventDeduplicationService;
import com.hookrelay.common.ratelimit.RateLimitConfig;
import com.hookrelay.common.ratelimit.RateLimitResult;
import com.hookrelay.common.ratelimit.RateLimitService;
import com.hookrelay.webhook.config.WebhookProperties;
import com.hookrelay.webhook.model.WebhookEvent;
import com.hookrelay.webhook.processor.WebhookEventProcessor;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Inbound webhook endpoint. Requests reach this controller only after their signature was verified.
 *
 * <p>Answers quickly: the actual work is handed to {@link WebhookEventProcessor}. Duplicates and
 * unknown event types are acknowledged with 200 so the platform does not redeliver them. When the
 * processing backlog is full the event is unmarked and answered with 503 so the platform retries it.
 */
@Slf4j
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
public class WebhookEventController {

    static final String URL_VERIFICATION = "url_verification";
    static final String EVENT_CALLBACK = "event_callback";

    private final RateLimitService rateLimitService;
    private final EventDeduplicationService deduplicationService;
    private final WebhookEventProcessor eventProcessor;
    private final WebhookProperties properties;

    @PostMapping("/events")
    public ResponseEntity<Map<String, String>> handleEvent(@RequestBody JsonNode payload, HttpServletRequest request) {
        String type = payload.path("type").asText("");

        if (URL_VERIFICATION.equals(type)) {
            log.info("Handling URL verification challenge");
            return ResponseEntity.ok(Map.of("challenge", payload.path("challenge").asText("")));
        }

        if (!EVENT_CALLBACK.equals(type)) {
            log.warn("Unknown event type received: type={}", type);
            return ResponseEntity.ok(Map.of("status", "ignored"));
        }

        String eventId = requiredField(payload, "event_id");
        String teamId = requiredField(payload, "team_id");

        enforceRateLimits(teamId, clientIp(request));

        if (deduplicationService.checkAndMark(eventId)) {
            log.info("Dropping duplicate event: eventId={}, teamId={}", eventId, teamId);
            return ResponseEntity.ok(Map.of("status", "duplicate"));
        }

        JsonNode inner = payload.path("event");
        WebhookEvent event = new WebhookEvent(eventId, teamId, inner.path("type").asText(null), inner);
        try {
            eventProcessor.submit(event);
        } catch (RejectedExecutionException e) {
            deduplicationService.clearEvent(eventId);
            throw new ProcessingBacklogFullException("Webhook processing backlog is full, retry later", e);
        }

        log.info("Event accepted: eventId={}, teamId={}, eventType={}", eventId, teamId, event.eventType());
        return ResponseEntity.ok(Map.of("status", "accepted"));
    }

    private void enforceRateLimits(String teamId, String clientIp) {
        WebhookProperties.Inbound inbound = properties.getInbound();
        long windowMs = inbound.getWindow().toMillis();

        RateLimitResult result = rateLimitService.checkMultipleLimits(List.of(
                new RateLimitConfig("team:" + teamId, inbound.getTeamLimit(), windowMs),
                new RateLimitConfig("ip:" + clientIp, inbound.getIpLimit(), windowMs)));

        if (!result.isAllowed()) {
            throw new RateLimitExceededException("Too many webhook deliveries, retry later", result);
        }
    }

    private static String requiredField(JsonNode payload, String field) {
        String value = payload.path(field).asText("");
        if (value.isBlank()) {
            throw new WebhookValidationException("Missing required field: " + field);
        }
        return value;
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
