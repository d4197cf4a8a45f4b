package com.hookrelay.common.signature;

import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.exception.SignatureConfigurationException;
import com.hookrelay.common.exception.WebhookAuthenticationException;
import com.hookrelay.common.exception.WebhookValidationException;
import com.hookrelay.common.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebhookSignatureVerifier Tests")
class WebhookSignatureVerifierTest {

    private static final long NOW_SECONDS = 1_700_000_000L;
    private static final String HEADER = "x-hookrelay-signature";
    private static final String TIMESTAMP_HEADER = "x-hookrelay-request-timestamp";
    private static final byte[] BODY = "{\"type\":\"event_callback\",\"event_id\":\"Ev1\"}"
            .getBytes(StandardCharsets.UTF_8);

    private MutableClock clock;
    private HookRelayProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(NOW_SECONDS * 1000);
        properties = new HookRelayProperties();
        properties.getSignature().setSecret("test-signing-secret");
        verifier = new WebhookSignatureVerifier(properties, clock);
    }

    private static Map<String, String> headers(String signature, long timestamp) {
        return Map.of(HEADER, signature, TIMESTAMP_HEADER, Long.toString(timestamp));
    }

    private Map<String, String> signed(long timestamp, byte[] body) {
        return headers(verifier.sign(timestamp, body), timestamp);
    }

    @Nested
    @DisplayName("Accepted requests")
    class AcceptedTests {

        @Test
        @DisplayName("Should accept a correctly signed request")
        void shouldAcceptValidSignature() {
            SignatureVerification result = verifier.verify(signed(NOW_SECONDS, BODY), BODY);

            assertThat(result.isValid()).isTrue();
        }

        @Test
        @DisplayName("Should match header names case-insensitively")
        void shouldIgnoreHeaderCase() {
            String header = verifier.sign(NOW_SECONDS, BODY);

            assertThat(verifier.verify(Map.of("X-HookRelay-Signature", header,
                    "X-HookRelay-Request-Timestamp", Long.toString(NOW_SECONDS)), BODY).isValid()).isTrue();
        }

        @Test
        @DisplayName("Should accept when any of several digests matches")
        void shouldAcceptAnyMatchingDigest() {
            String valid = verifier.sign(NOW_SECONDS, BODY);
            String header = "t=" + NOW_SECONDS + ",v1=" + "00".repeat(32) + "," + valid.substring(valid.indexOf("v1="));

            assertThat(verifier.verify(headers(header, NOW_SECONDS), BODY).isValid()).isTrue();
        }

        @Test
        @DisplayName("Should accept timestamps at the edge of the tolerance")
        void shouldAcceptAtToleranceEdge() {
            assertThat(verifier.verify(signed(NOW_SECONDS - 300, BODY), BODY).isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Rejected requests")
    class RejectedTests {

        @Test
        @DisplayName("Should reject as unauthenticated when a single body byte changes")
        void shouldRejectTamperedBody() {
            byte[] tampered = BODY.clone();
            tampered[10] ^= 0x01;

            SignatureVerification result = verifier.verify(signed(NOW_SECONDS, BODY), tampered);

            assertThat(result.isValid()).isFalse();
            assertThat(result.getFailure()).isEqualTo(SignatureFailure.UNAUTHENTICATED);
        }

        @Test
        @DisplayName("Should reject a missing header as a validation failure")
        void shouldRejectMissingHeader() {
            SignatureVerification result = verifier.verify(Map.of(), BODY);

            assertThat(result.getFailure()).isEqualTo(SignatureFailure.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("Should reject a correctly signed request without the timestamp header")
        void shouldRejectMissingCompanionTimestamp() {
            String header = verifier.sign(NOW_SECONDS, BODY);

            SignatureVerification result = verifier.verify(Map.of(HEADER, header), BODY);

            assertThat(result.isValid()).isFalse();
            assertThat(result.getFailure()).isEqualTo(SignatureFailure.VALIDATION_FAILED);
            assertThat(result.getReason()).contains(TIMESTAMP_HEADER);
        }

        @Test
        @DisplayName("Should reject a blank timestamp header")
        void shouldRejectBlankCompanionTimestamp() {
            String header = verifier.sign(NOW_SECONDS, BODY);

            SignatureVerification result = verifier.verify(Map.of(HEADER, header, TIMESTAMP_HEADER, " "), BODY);

            assertThat(result.getFailure()).isEqualTo(SignatureFailure.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("Should reject a header without v1")
        void shouldRejectMissingDigest() {
            SignatureVerification result = verifier.verify(headers("t=" + NOW_SECONDS, NOW_SECONDS), BODY);

            assertThat(result.getFailure()).isEqualTo(SignatureFailure.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("Should reject an unparsable timestamp")
        void shouldRejectBadTimestamp() {
            SignatureVerification result = verifier.verify(headers("t=yesterday,v1=abcd", NOW_SECONDS), BODY);

            assertThat(result.getFailure()).isEqualTo(SignatureFailure.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("Should reject a replayed request outside the window before checking the digest")
        void shouldRejectStaleTimestamp() {
            Map<String, String> headers = signed(NOW_SECONDS, BODY);
            clock.advance(Duration.ofSeconds(301));

            SignatureVerification result = verifier.verify(headers, BODY);

            assertThat(result.getFailure()).isEqualTo(SignatureFailure.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("Should reject timestamps too far in the future")
        void shouldRejectFutureTimestamp() {
            assertThat(verifier.verify(signed(NOW_SECONDS + 301, BODY), BODY).getFailure())
                    .isEqualTo(SignatureFailure.VALIDATION_FAILED);
        }

        @Test
        @DisplayName("Should reject a companion timestamp that differs from t")
        void shouldRejectMismatchedCompanionTimestamp() {
            String header = verifier.sign(NOW_SECONDS, BODY);

            SignatureVerification result = verifier.verify(
                    headers(header, NOW_SECONDS - 1), BODY);

            assertThat(result.getFailure()).isEqualTo(SignatureFailure.VALIDATION_FAILED);
        }
    }

    @Nested
    @DisplayName("Exceptions")
    class ExceptionTests {

        @Test
        @DisplayName("Should raise the exception matching the failure")
        void shouldThrowMatchingException() {
            Map<String, String> headers = signed(NOW_SECONDS, BODY);

            assertThatThrownBy(() -> verifier.verifyOrThrow(headers, "other".getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(WebhookAuthenticationException.class);
            assertThatThrownBy(() -> verifier.verifyOrThrow(Map.of(), BODY))
                    .isInstanceOf(WebhookValidationException.class);
        }

        @Test
        @DisplayName("Should fail with a configuration error when no secret is set")
        void shouldRequireSecret() {
            properties.getSignature().setSecret(null);

            assertThatThrownBy(() -> verifier.verify(headers("t=" + NOW_SECONDS + ",v1=abcd", NOW_SECONDS), BODY))
                    .isInstanceOf(SignatureConfigurationException.class);
        }
    }

    @Test
    @DisplayName("Should redact digests from header values")
    void shouldRedactDigest() {
        String header = verifier.sign(NOW_SECONDS, BODY);

        String redacted = WebhookSignatureVerifier.redact(header);

        assertThat(redacted).contains("t=" + NOW_SECONDS).doesNotContain(header.substring(header.indexOf("v1=") + 3));
    }
}
