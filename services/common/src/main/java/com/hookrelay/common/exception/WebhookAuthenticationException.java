package com.hookrelay.common.exception;

/**
 * Signature digest did not match the request.
 */
public class WebhookAuthenticationException extends HookRelayException {

    public WebhookAuthenticationException(String message) {
        super(ErrorCode.WEBHOOK_UNAUTHENTICATED, message);
    }
}
