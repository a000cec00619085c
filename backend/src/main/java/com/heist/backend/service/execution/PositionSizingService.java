package com.heist.backend.service.execution;

import com.heist.backend.config.ExecutionProperties;
import com.heist.backend.model.RiskLimits;
import com.heist.backend.model.SizingState;
import com.heist.backend.model.SizingStrategy;
import com.heist.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Position sizing plus the streak and daily counters that drive it.
 */
@Service
@Slf4j
public class PositionSizingService {

    static final double ADAPTIVE_BASE = 0.15;
    static final double ADAPTIVE_FLOOR = 0.05;
    static final double ADAPTIVE_CEILING = 0.30;

    private final SizingStrategy strategy;
    private final RiskLimits limits;
    private final int configuredMaxOpen;

    private int tradesToday;
    private int totalTrades;
    private int winStreak;
    private int lossStreak;
    private double dailyPnlFraction;

    public PositionSizingService(ExecutionProperties properties) {
        this.strategy = properties.getStrategy();
        this.limits = RiskLimits.forStrategy(strategy);
        this.configuredMaxOpen = properties.getMaxOpenPositions();
    }

    public RiskLimits limits() {
        return limits;
    }

    public SizingStrategy strategy() {
        return strategy;
    }

    /**
     * Ceiling on open positions: the stricter of the configured value and the strategy's.
     */
    public int maxOpenPositions() {
        if (configuredMaxOpen <= 0) {
            return limits.maxOpenPositions();
        }
        return Math.min(configuredMaxOpen, limits.maxOpenPositions());
    }

    public synchronized double basePercent() {
        if (strategy != SizingStrategy.ADAPTIVE) {
            return limits.maxPositionFraction();
        }
        double base = ADAPTIVE_BASE;
        if (winStreak >= 3) {
            base += Math.min(0.15, winStreak * 0.03);
        } else if (lossStreak >= 2) {
            base -= Math.min(0.10, lossStreak * 0.05);
        }
        // only losses count towards the daily limit
        double lossProximity = dailyPnlFraction < 0
                ? Math.abs(dailyPnlFraction) / limits.dailyLossLimitFraction()
                : 0.0;
        if (lossProximity > 0.5) {
            base *= (1 - lossProximity * 0.3);
        }
        return Math.max(ADAPTIVE_FLOOR, Math.min(ADAPTIVE_CEILING, base));
    }

    /**
     * balance x base percent, clamped to the strategy's trade bounds, then shrunk by
     * 10% per open position but never below half.
     */
    public BigDecimal positionSize(BigDecimal walletBalanceUsd, int openPositions) {
        double percent = basePercent();
        double size = walletBalanceUsd.doubleValue() * percent;
        size = Math.max(limits.minTradeUsd(), Math.min(size, limits.maxTradeUsd()));
        if (openPositions > 0) {
            size *= Math.max(0.5, 1.0 - 0.1 * openPositions);
        }
        BigDecimal result = MoneyUtils.bd(size);
        log.info("💰 Position size ${} ({}% of ${}, open={})", result,
                String.format("%.1f", percent * 100), walletBalanceUsd, openPositions);
        return result;
    }

    public synchronized void recordTradeOpened() {
        tradesToday++;
    }

    /**
     * @param pnlFraction realised return of the closed trade, 0.25 for +25%
     */
    public synchronized void recordTradeResult(double pnlFraction) {
        totalTrades++;
        dailyPnlFraction += pnlFraction;
        if (pnlFraction > 0) {
            winStreak++;
            lossStreak = 0;
            log.info("✅ Win #{}", winStreak);
        } else {
            lossStreak++;
            winStreak = 0;
            log.info("❌ Loss #{}", lossStreak);
        }
    }

    public synchronized void resetDaily() {
        log.info("📊 Daily stats: {} trades, P&L: {}%", tradesToday, String.format("%+.2f", dailyPnlFraction * 100));
        tradesToday = 0;
        dailyPnlFraction = 0.0;
    }

    public synchronized SizingState state() {
        return SizingState.builder()
                .strategy(strategy)
                .tradesToday(tradesToday)
                .totalTrades(totalTrades)
                .winStreak(winStreak)
                .lossStreak(lossStreak)
                .dailyPnlFraction(dailyPnlFraction)
                .currentBasePercent(basePercent())
                .build();
    }
}
