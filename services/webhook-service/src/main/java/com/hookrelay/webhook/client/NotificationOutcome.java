package com.hookrelay.webhook.client;

public enum NotificationOutcome {
    SENT,
    DISABLED,
    SKIPPED_RATE_LIMITED,
    SKIPPED_CIRCUIT_OPEN
}
