package com.hookrelay.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the HookRelay platform.
 * Format: MODULE_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== WEBHOOK INGRESS ERRORS (WEBHOOK_XXX) =====
    WEBHOOK_VALIDATION_FAILED("WEBHOOK_001", "Webhook request failed validation", HttpStatus.BAD_REQUEST),
    WEBHOOK_UNAUTHENTICATED("WEBHOOK_002", "Invalid webhook signature", HttpStatus.UNAUTHORIZED),
    WEBHOOK_SIGNING_NOT_CONFIGURED("WEBHOOK_003", "Webhook signing secret not configured", HttpStatus.INTERNAL_SERVER_ERROR),
    WEBHOOK_BACKLOG_FULL("WEBHOOK_004", "Webhook processing backlog is full", HttpStatus.SERVICE_UNAVAILABLE),

    // ===== COORDINATION ERRORS (LOCK_XXX) =====
    LOCK_ACQUISITION_TIMEOUT("LOCK_001", "Failed to acquire distributed lock", HttpStatus.CONFLICT),

    // ===== RATE LIMIT ERRORS (RATE_XXX) =====
    RATE_LIMITED("RATE_001", "Rate limit exceeded", HttpStatus.TOO_MANY_REQUESTS),

    // ===== DOWNSTREAM ERRORS (DOWNSTREAM_XXX) =====
    CIRCUIT_OPEN("DOWNSTREAM_001", "Downstream circuit breaker is open", HttpStatus.SERVICE_UNAVAILABLE),

    // ===== INFRASTRUCTURE ERRORS (INFRA_XXX) =====
    STORE_UNAVAILABLE("INFRA_001", "Shared store is unavailable", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;

    ErrorCode(String code, String defaultMessage, HttpStatus status) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
