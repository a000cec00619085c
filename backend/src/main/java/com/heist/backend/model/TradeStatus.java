package com.heist.backend.model;

/**
 * Position lifecycle. CLOSED, FAILED and CANCELLED are terminal.
 */
public enum TradeStatus {
    PENDING,
    EXECUTING,
    OPEN,
    CLOSED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TradeStatus target) {
        if (target == null) return false;

        return switch (this) {
            case PENDING -> target == EXECUTING || target == FAILED || target == CANCELLED;
            case EXECUTING -> target == OPEN || target == FAILED || target == CANCELLED;
            case OPEN -> target == CLOSED;
            default -> false;
        };
    }
}
