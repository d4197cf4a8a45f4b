package com.hookrelay.common.signature;

import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.exception.SignatureConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Verifies authenticity and freshness of inbound webhook requests.
 *
 * <p>The signature header has the form {@code t=<unixSeconds>,v1=<hexDigest>} where the digest is
 * HMAC-SHA256 over {@code "<t>:<rawBody>"} keyed with the server secret. Requests are rejected when:
 * <ul>
 *   <li>the header or one of its fields is missing or unparsable (validation failure)</li>
 *   <li>the companion timestamp header is missing or disagrees with {@code t} (validation failure)</li>
 *   <li>{@code |now - t|} exceeds the tolerance, 300 seconds by default (validation failure)</li>
 *   <li>no supplied digest matches (authentication failure)</li>
 * </ul>
 *
 * <p>Digests are compared with {@link MessageDigest#isEqual}, which does not short-circuit on the
 * first differing byte. This class has no side effects beyond logging and must run before any
 * state-mutating logic.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    static final String HMAC_ALGORITHM = "HmacSHA256";
    static final String TIMESTAMP_FIELD = "t";
    static final String SIGNATURE_FIELD = "v1";

    private final HookRelayProperties.Signature config;
    private final Clock clock;

    public WebhookSignatureVerifier(HookRelayProperties properties, Clock clock) {
        this.config = properties.getSignature();
        this.clock = clock;
    }

    /**
     * Verifies the request.
     *
     * @param headers request headers; names are matched case-insensitively
     * @param rawBody the exact bytes received, before any parsing
     */
    public SignatureVerification verify(Map<String, String> headers, byte[] rawBody) {
        Map<String, String> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(headers);

        String header = lookup.get(config.getHeader());
        if (header == null || header.isBlank()) {
            return reject(SignatureFailure.VALIDATION_FAILED, "Missing signature header " + config.getHeader(), null);
        }

        String companion = lookup.get(config.getTimestampHeader());
        if (companion == null || companion.isBlank()) {
            return reject(SignatureFailure.VALIDATION_FAILED, "Missing timestamp header " + config.getTimestampHeader(), header);
        }

        ParsedHeader parsed = parse(header);
        if (parsed.timestamp == null) {
            return reject(SignatureFailure.VALIDATION_FAILED, "Missing or invalid signature timestamp", header);
        }
        if (parsed.digests.isEmpty()) {
            return reject(SignatureFailure.VALIDATION_FAILED, "Missing or invalid signature digest", header);
        }

        if (!companion.trim().equals(Long.toString(parsed.timestamp))) {
            return reject(SignatureFailure.VALIDATION_FAILED, "Timestamp header does not match signature timestamp", header);
        }

        long skewSeconds = Math.abs(clock.instant().getEpochSecond() - parsed.timestamp);
        if (skewSeconds > config.getTolerance().getSeconds()) {
            return reject(SignatureFailure.VALIDATION_FAILED, "Request timestamp outside replay window", header);
        }

        byte[] expected = digest(parsed.timestamp, rawBody);
        boolean matched = false;
        for (byte[] supplied : parsed.digests) {
            // evaluate every candidate so timing does not reveal which one matched
            matched |= MessageDigest.isEqual(expected, supplied);
        }
        if (!matched) {
            return reject(SignatureFailure.UNAUTHENTICATED, "Invalid webhook signature", header);
        }

        log.debug("Webhook signature verified: t={}", parsed.timestamp);
        return SignatureVerification.ok();
    }

    /**
     * @throws com.hookrelay.common.exception.WebhookValidationException for malformed or stale requests
     * @throws com.hookrelay.common.exception.WebhookAuthenticationException for digest mismatch
     */
    public void verifyOrThrow(Map<String, String> headers, byte[] rawBody) {
        verify(headers, rawBody).orThrow();
    }

    /**
     * Produces a signature header value for the given timestamp and body.
     */
    public String sign(long timestampSeconds, byte[] rawBody) {
        return TIMESTAMP_FIELD + "=" + timestampSeconds + ","
                + SIGNATURE_FIELD + "=" + HexFormat.of().formatHex(digest(timestampSeconds, rawBody));
    }

    public Duration getTolerance() {
        return config.getTolerance();
    }

    private byte[] digest(long timestampSeconds, byte[] rawBody) {
        String secret = config.getSecret();
        if (secret == null || secret.isEmpty()) {
            throw new SignatureConfigurationException("Webhook signing secret not configured");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            mac.update((timestampSeconds + ":").getBytes(StandardCharsets.UTF_8));
            return mac.doFinal(rawBody);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC computation failed", e);
        }
    }

    private static ParsedHeader parse(String header) {
        ParsedHeader parsed = new ParsedHeader();
        for (String part : header.split(",")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();
            if (TIMESTAMP_FIELD.equals(name)) {
                parsed.timestamp = parseTimestamp(value);
            } else if (SIGNATURE_FIELD.equals(name) && !value.isEmpty()) {
                try {
                    parsed.digests.add(HexFormat.of().parseHex(value));
                } catch (IllegalArgumentException e) {
                    log.debug("Ignoring non-hex signature value");
                }
            }
        }
        return parsed;
    }

    private static Long parseTimestamp(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private SignatureVerification reject(SignatureFailure failure, String reason, String header) {
        log.warn("Webhook signature rejected: failure={}, reason={}, header={}", failure, reason, redact(header));
        return SignatureVerification.rejected(failure, reason);
    }

    static String redact(String header) {
        if (header == null) {
            return "<absent>";
        }
        StringBuilder redacted = new StringBuilder();
        for (String part : header.split(",")) {
            if (redacted.length() > 0) {
                redacted.append(',');
            }
            int eq = part.indexOf('=');
            String name = eq > 0 ? part.substring(0, eq).trim() : part.trim();
            if (TIMESTAMP_FIELD.equals(name)) {
                redacted.append(part.trim());
            } else {
                redacted.append(name).append("=<redacted>");
            }
        }
        return redacted.toString();
    }

    private static final class ParsedHeader {
        private Long timestamp;
        private final List<byte[]> digests = new ArrayList<>();
    }
}
