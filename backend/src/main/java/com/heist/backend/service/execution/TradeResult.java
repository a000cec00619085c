package com.heist.backend.service.execution;

import com.heist.backend.model.PositionSnapshot;

/**
 * Outcome of a buy or sell. Failures carry a kind so callers can tell a full book
 * from a flaky collaborator.
 */
public record TradeResult(boolean success, PositionSnapshot position, FailureKind failureKind, String message) {

    public static TradeResult success(PositionSnapshot position, String message) {
        return new TradeResult(true, position, null, message);
    }

    public static TradeResult failure(FailureKind kind, String message) {
        return new TradeResult(false, null, kind, message);
    }

    public static TradeResult failure(FailureKind kind, PositionSnapshot position, String message) {
        return new TradeResult(false, position, kind, message);
    }

    public enum FailureKind {
        /** Position ceiling, risk gate or sizing refused the trade. */
        CAPACITY,
        /** Unknown position, double close or an illegal state change. */
        INVARIANT,
        /** Collaborator failed or timed out; retrying later may succeed. */
        TRANSIENT,
        /** Input the engine cannot act on, such as an unsupported chain. */
        VALIDATION
    }
}
