package com.hookrelay.webhook.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.common.exception.ErrorCode;
import com.hookrelay.common.exception.SignatureConfigurationException;
import com.hookrelay.common.signature.SignatureFailure;
import com.hookrelay.common.signature.SignatureVerification;
import com.hookrelay.common.signature.WebhookSignatureVerifier;
import com.hookrelay.webhook.exception.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.util.StreamUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Verifies the signature of every inbound webhook before any handler sees it.
 *
 * <p>The body is read once, verified as raw bytes and handed downstream in a replayable
 * wrapper, so handlers parse exactly the bytes that were signed.
 */
@Slf4j
@RequiredArgsConstructor
public class WebhookSignatureFilter extends OncePerRequestFilter {

    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        byte[] body = StreamUtils.copyToByteArray(request.getInputStream());

        SignatureVerification verification;
        try {
            verification = signatureVerifier.verify(headers(request), body);
        } catch (SignatureConfigurationException e) {
            log.error("Webhook signature verification not configured: path={}", request.getRequestURI());
            writeError(response, request, ErrorCode.WEBHOOK_SIGNING_NOT_CONFIGURED, e.getMessage());
            return;
        }

        if (!verification.isValid()) {
            ErrorCode code = verification.getFailure() == SignatureFailure.UNAUTHENTICATED
                    ? ErrorCode.WEBHOOK_UNAUTHENTICATED
                    : ErrorCode.WEBHOOK_VALIDATION_FAILED;
            log.warn("Webhook rejected: path={}, remoteAddr={}, reason={}",
                    request.getRequestURI(), request.getRemoteAddr(), verification.getReason());
            writeError(response, request, code, verification.getReason());
            return;
        }

        filterChain.doFilter(new CachedBodyHttpServletRequest(request, body), response);
    }

    private static Map<String, String> headers(HttpServletRequest request) {
        Map<String, String> headers = new HashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return headers;
    }

    private void writeError(HttpServletResponse response, HttpServletRequest request,
                            ErrorCode code, String message) throws IOException {
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(code.getStatus().value())
                .error(code.getCode())
                .message(message)
                .path(request.getRequestURI())
                .errorId(UUID.randomUUID().toString())
                .build();
        response.setStatus(code.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
