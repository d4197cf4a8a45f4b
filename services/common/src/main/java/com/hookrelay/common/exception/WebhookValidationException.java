package com.hookrelay.common.exception;

/**
 * Malformed or missing signature fields, or a timestamp outside the replay window.
 * Not retryable by the sender.
 */
public class WebhookValidationException extends HookRelayException {

    public WebhookValidationException(String message) {
        super(ErrorCode.WEBHOOK_VALIDATION_FAILED, message);
    }
}
