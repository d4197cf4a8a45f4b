package com.hookrelay.common.resilience;

public enum CircuitPhase {
    CLOSED,
    OPEN,
    HALF_OPEN
}
