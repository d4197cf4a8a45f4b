package com.hookrelay.webhook.exception;

import com.hookrelay.common.exception.CircuitOpenException;
import com.hookrelay.common.exception.HookRelayException;
import com.hookrelay.common.exception.LockAcquisitionTimeoutException;
import com.hookrelay.common.exception.ProcessingBacklogFullException;
import com.hookrelay.common.exception.RateLimitExceededException;
import com.hookrelay.common.exception.StoreUnavailableException;
import com.hookrelay.common.exception.WebhookAuthenticationException;
import com.hookrelay.common.exception.WebhookValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Translates failures into {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WebhookValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebhookValidationException ex, HttpServletRequest request) {
        log.warn("Webhook validation failed - Error ID: {} - {}", ex.getErrorId(), ex.getMessage());
        return build(ex, request, null, new HttpHeaders());
    }

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(WebhookAuthenticationException ex,
                                                              HttpServletRequest request) {
        log.warn("Webhook authentication failed - Error ID: {} - {}", ex.getErrorId(), ex.getMessage());
        return build(ex, request, null, new HttpHeaders());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitExceeded(RateLimitExceededException ex,
                                                                 HttpServletRequest request) {
        log.warn("Rate limit exceeded - Error ID: {} - {}", ex.getErrorId(), ex.getMessage());

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        headers.add("X-RateLimit-Limit", String.valueOf(ex.getLimit()));
        headers.add("X-RateLimit-Remaining", String.valueOf(ex.getRemaining()));
        headers.add("X-RateLimit-Reset", String.valueOf(ex.getResetEpochSeconds()));

        return build(ex, request, Map.of("retryAfter", ex.getRetryAfterSeconds()), headers);
    }

    @ExceptionHandler(LockAcquisitionTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleLockTimeout(LockAcquisitionTimeoutException ex,
                                                           HttpServletRequest request) {
        log.warn("Lock acquisition timed out - Error ID: {} - lockKey={}, attempts={}",
                ex.getErrorId(), ex.getLockKey(), ex.getAttempts());
        return build(ex, request, Map.of("lockKey", ex.getLockKey()), new HttpHeaders());
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ErrorResponse> handleCircuitOpen(CircuitOpenException ex, HttpServletRequest request) {
        log.warn("Downstream circuit open - Error ID: {} - circuitKey={}", ex.getErrorId(), ex.getCircuitKey());
        return build(ex, request, Map.of("circuitKey", ex.getCircuitKey()), new HttpHeaders());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex,
                                                                HttpServletRequest request) {
        log.error("Shared store unavailable - Error ID: {} - {}", ex.getErrorId(), ex.getMessage(), ex);
        return build(ex, request, null, new HttpHeaders());
    }

    @ExceptionHandler(ProcessingBacklogFullException.class)
    public ResponseEntity<ErrorResponse> handleBacklogFull(ProcessingBacklogFullException ex,
                                                           HttpServletRequest request) {
        log.error("Processing backlog full - Error ID: {} - {}", ex.getErrorId(), ex.getMessage());
        return build(ex, request, null, new HttpHeaders());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        log.warn("Unreadable request body: path={}", request.getRequestURI());
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("MALFORMED_REQUEST")
                .message("Request body is not valid JSON")
                .path(request.getRequestURI())
                .errorId(UUID.randomUUID().toString())
                .build();
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String errorId = UUID.randomUUID().toString();
        log.error("Unexpected error - Error ID: {} - {}", errorId, ex.getMessage(), ex);
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("INTERNAL_ERROR")
                .message("An unexpected error occurred")
                .path(request.getRequestURI())
                .errorId(errorId)
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static ResponseEntity<ErrorResponse> build(HookRelayException ex, HttpServletRequest request,
                                                       Map<String, Object> details, HttpHeaders headers) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(ex.getTimestamp())
                .status(ex.getStatus().value())
                .error(ex.getErrorCode().getCode())
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .errorId(ex.getErrorId())
                .details(details)
                .build();
        return new ResponseEntity<>(body, headers, ex.getStatus());
    }
}
