package com.heist.backend.model;

public enum ExitReason {
    PROFIT_TARGET,
    STOP_LOSS,
    TRAILING_STOP,
    MAX_HOLD_TIME,
    MANUAL
}
