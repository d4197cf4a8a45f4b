package com.hookrelay.webhook.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint of the service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private Instant timestamp;

    private int status;

    /**
     * Stable error code, e.g. {@code WEBHOOK_001}.
     */
    private String error;

    private String message;

    private String path;

    private String errorId;

    private Map<String, Object> details;
}
