package com.hookrelay.common.exception;

/**
 * The shared atomic store could not be reached or returned an error.
 * Each consumer decides whether to fail open, fail closed or propagate.
 */
public class StoreUnavailableException extends HookRelayException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }

    public StoreUnavailableException(String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message);
    }
}
