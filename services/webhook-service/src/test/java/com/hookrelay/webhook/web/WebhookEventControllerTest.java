package com.hookrelay.webhook.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.exception.StoreUnavailableException;
import com.hookrelay.common.idempotency.EventDeduplicationService;
import com.hookrelay.common.ratelimit.RateLimitResult;
import com.hookrelay.common.ratelimit.RateLimitService;
import com.hookrelay.common.signature.WebhookSignatureVerifier;
import com.hookrelay.webhook.config.WebhookProperties;
import com.hookrelay.webhook.exception.GlobalExceptionHandler;
import com.hookrelay.webhook.filter.WebhookSignatureFilter;
import com.hookrelay.webhook.model.WebhookEvent;
import com.hookrelay.webhook.processor.WebhookEventProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookEventController Tests")
class WebhookEventControllerTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);
    private static final String SIGNATURE_HEADER = "x-hookrelay-signature";
    private static final String TIMESTAMP_HEADER = "x-hookrelay-request-timestamp";

    @Mock
    private RateLimitService rateLimitService;

    @Mock
    private EventDeduplicationService deduplicationService;

    @Mock
    private WebhookEventProcessor eventProcessor;

    private WebhookSignatureVerifier verifier;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        HookRelayProperties properties = new HookRelayProperties();
        properties.getSignature().setSecret("controller-test-secret");
        verifier = new WebhookSignatureVerifier(properties, Clock.fixed(NOW, ZoneOffset.UTC));
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

        WebhookEventController controller = new WebhookEventController(
                rateLimitService, deduplicationService, eventProcessor, new WebhookProperties());

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilter(new WebhookSignatureFilter(verifier, objectMapper), "/webhooks/*")
                .build();
    }

    private ResultActions postSigned(String body) throws Exception {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return mockMvc.perform(post("/webhooks/events")
                .contentType(MediaType.APPLICATION_JSON)
                .header(SIGNATURE_HEADER, verifier.sign(NOW.getEpochSecond(), bytes))
                .header(TIMESTAMP_HEADER, NOW.getEpochSecond())
                .content(bytes));
    }

    private static RateLimitResult allowed() {
        return RateLimitResult.builder().allowed(true).limit(300).remaining(299).resetTime(NOW.plusSeconds(60)).build();
    }

    private static String eventCallback(String eventId) {
        return "{\"type\":\"event_callback\",\"event_id\":\"" + eventId + "\",\"team_id\":\"T1\","
                + "\"event\":{\"type\":\"message\",\"text\":\"hi\"}}";
    }

    @Nested
    @DisplayName("Signature gate")
    class SignatureGateTests {

        @Test
        @DisplayName("Should reject unsigned requests with 400 before any processing")
        void shouldRejectUnsigned() throws Exception {
            mockMvc.perform(post("/webhooks/events")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(eventCallback("Ev1")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("WEBHOOK_001"));

            verifyNoInteractions(rateLimitService, deduplicationService, eventProcessor);
        }

        @Test
        @DisplayName("Should reject a tampered body with 401")
        void shouldRejectTampered() throws Exception {
            byte[] signed = eventCallback("Ev1").getBytes(StandardCharsets.UTF_8);

            mockMvc.perform(post("/webhooks/events")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header(SIGNATURE_HEADER, verifier.sign(NOW.getEpochSecond(), signed))
                            .header(TIMESTAMP_HEADER, NOW.getEpochSecond())
                            .content(eventCallback("Ev2")))
                    .andExpect(status().isUnauthorized());

            verifyNoInteractions(deduplicationService, eventProcessor);
        }

        @Test
        @DisplayName("Should reject a signed request without the timestamp header with 400")
        void shouldRejectMissingTimestampHeader() throws Exception {
            byte[] bytes = eventCallback("Ev1").getBytes(StandardCharsets.UTF_8);

            mockMvc.perform(post("/webhooks/events")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header(SIGNATURE_HEADER, verifier.sign(NOW.getEpochSecond(), bytes))
                            .content(bytes))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("WEBHOOK_001"));

            verifyNoInteractions(rateLimitService, deduplicationService, eventProcessor);
        }
    }

    @Nested
    @DisplayName("Event handling")
    class EventHandlingTests {

        @Test
        @DisplayName("Should echo the URL verification challenge")
        void shouldAnswerChallenge() throws Exception {
            postSigned("{\"type\":\"url_verification\",\"challenge\":\"abc123\"}")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.challenge").value("abc123"));
        }

        @Test
        @DisplayName("Should accept a new event and hand it to the processor")
        void shouldAcceptNewEvent() throws Exception {
            when(rateLimitService.checkMultipleLimits(anyList())).thenReturn(allowed());
            when(deduplicationService.checkAndMark("Ev1")).thenReturn(false);

            postSigned(eventCallback("Ev1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("accepted"));

            ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
            verify(eventProcessor).submit(captor.capture());
            assertThat(captor.getValue().eventId()).isEqualTo("Ev1");
            assertThat(captor.getValue().teamId()).isEqualTo("T1");
            assertThat(captor.getValue().eventType()).isEqualTo("message");
        }

        @Test
        @DisplayName("Should acknowledge duplicates with 200 and not process them")
        void shouldAcknowledgeDuplicate() throws Exception {
            when(rateLimitService.checkMultipleLimits(anyList())).thenReturn(allowed());
            when(deduplicationService.checkAndMark("Ev1")).thenReturn(true);

            postSigned(eventCallback("Ev1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("duplicate"));

            verify(eventProcessor, never()).submit(org.mockito.ArgumentMatchers.any());
        }

        @Test
        @DisplayName("Should answer 429 with Retry-After when a limit rejects")
        void shouldRateLimit() throws Exception {
            when(rateLimitService.checkMultipleLimits(anyList())).thenReturn(RateLimitResult.builder()
                    .allowed(false).limit(300).remaining(0).resetTime(NOW.plusSeconds(42)).retryAfter(42L).build());

            postSigned(eventCallback("Ev1"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(header().string("Retry-After", "42"))
                    .andExpect(header().string("X-RateLimit-Limit", "300"));

            verifyNoInteractions(deduplicationService, eventProcessor);
        }

        @Test
        @DisplayName("Should answer 503 when deduplication rejects on store failure")
        void shouldReportStoreFailure() throws Exception {
            when(rateLimitService.checkMultipleLimits(anyList())).thenReturn(allowed());
            when(deduplicationService.checkAndMark("Ev1")).thenThrow(new StoreUnavailableException("redis down"));

            postSigned(eventCallback("Ev1"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("INFRA_001"));
        }

        @Test
        @DisplayName("Should answer 503 and unmark the event when the processing backlog is full")
        void shouldRefuseWhenBacklogFull() throws Exception {
            when(rateLimitService.checkMultipleLimits(anyList())).thenReturn(allowed());
            when(deduplicationService.checkAndMark("Ev1")).thenReturn(false);
            when(eventProcessor.submit(org.mockito.ArgumentMatchers.any()))
                    .thenThrow(new RejectedExecutionException("queue full"));

            postSigned(eventCallback("Ev1"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("WEBHOOK_004"));

            verify(deduplicationService).clearEvent("Ev1");
        }

        @Test
        @DisplayName("Should reject event callbacks without an event id")
        void shouldRequireEventId() throws Exception {
            postSigned("{\"type\":\"event_callback\",\"team_id\":\"T1\"}")
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should ignore unknown payload types")
        void shouldIgnoreUnknownTypes() throws Exception {
            postSigned("{\"type\":\"app_rate_limited\"}")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("ignored"));
        }
    }
}
