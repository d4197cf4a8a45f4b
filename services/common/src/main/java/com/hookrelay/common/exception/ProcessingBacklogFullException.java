package com.hookrelay.common.exception;

/**
 * An accepted event could not be scheduled because the processing queue is full.
 */
public class ProcessingBacklogFullException extends HookRelayException {

    public ProcessingBacklogFullException(String message, Throwable cause) {
        super(ErrorCode.WEBHOOK_BACKLOG_FULL, message, cause);
    }
}
