package com.hookrelay.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Base exception for all HookRelay failures that carry an {@link ErrorCode}.
 *
 * <p>Each instance gets a unique error id so a failure seen by a caller can be
 * correlated with the log line that reported it.
 */
@Getter
public class HookRelayException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Instant timestamp;

    public HookRelayException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public HookRelayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    public HookRelayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }
}
