package com.heist.backend.service.execution;

import com.heist.backend.model.RiskLimits;
import com.heist.backend.model.SizingState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Refuses new buys regardless of available funds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskGatekeeper {

    static final int LOSS_STREAK_BREAKER = 5;

    private final PositionSizingService sizingService;

    /**
     * @param occupiedSlots open positions plus buys already in flight
     */
    public GuardDecision evaluate(int occupiedSlots) {
        int ceiling = sizingService.maxOpenPositions();
        if (occupiedSlots >= ceiling) {
            return GuardDecision.block("Maximum positions (" + ceiling + ") reached");
        }
        RiskLimits limits = sizingService.limits();
        SizingState state = sizingService.state();
        if (state.getTradesToday() >= limits.maxTradesPerDay()) {
            return GuardDecision.block("Daily trade limit reached (" + limits.maxTradesPerDay() + ")");
        }
        if (state.getDailyPnlFraction() <= -limits.dailyLossLimitFraction()) {
            return GuardDecision.block(String.format("Daily loss limit hit (%.2f%%)", state.getDailyPnlFraction() * 100));
        }
        if (state.getLossStreak() >= LOSS_STREAK_BREAKER) {
            log.warn("⛔ Losing streak {} tripped the breaker", state.getLossStreak());
            return GuardDecision.block("Losing streak too long (" + state.getLossStreak() + ")");
        }
        return GuardDecision.allow();
    }

    public record GuardDecision(boolean allowed, String reason) {

        static GuardDecision allow() {
            return new GuardDecision(true, null);
        }

        static GuardDecision block(String reason) {
            return new GuardDecision(false, reason);
        }
    }
}
