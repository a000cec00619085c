package com.heist.backend.model;

/**
 * Per-strategy limits. Fractions are of wallet balance (0.15 = 15%).
 */
public record RiskLimits(
        double maxPositionFraction,
        int maxOpenPositions,
        double stopLossFraction,
        double takeProfitFraction,
        double dailyLossLimitFraction,
        int maxTradesPerDay,
        double minTradeUsd,
        double maxTradeUsd
) {

    public static RiskLimits forStrategy(SizingStrategy strategy) {
        return switch (strategy) {
            case CONSERVATIVE -> new RiskLimits(0.05, 5, 0.02, 0.05, 0.05, 15, 5.0, 5000.0);
            case AGGRESSIVE -> new RiskLimits(0.30, 3, 0.03, 0.02, 0.10, 10, 5.0, 20000.0);
            case BALANCED, ADAPTIVE -> new RiskLimits(0.15, 4, 0.025, 0.04, 0.08, 12, 5.0, 10000.0);
        };
    }
}
