package com.hookrelay.common.exception;

/**
 * Exception thrown when the server-side signing secret is missing.
 */
public class SignatureConfigurationException extends HookRelayException {

    public SignatureConfigurationException(String message) {
        super(ErrorCode.WEBHOOK_SIGNING_NOT_CONFIGURED, message);
    }
}
