package com.heist.backend.service.execution;

import com.heist.backend.config.ExecutionProperties;
import com.heist.backend.model.ExitReason;
import com.heist.backend.model.Position;
import com.heist.backend.model.RiskLimits;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Exit rules in fixed order: profit target, stop loss, trailing stop, hold time.
 * The first rule that fires is the only reason reported.
 */
@Service
@RequiredArgsConstructor
public class ExitPriorityEngine {

    private final ExecutionProperties properties;
    private final PositionSizingService sizingService;

    public ExitDecision evaluate(Position position, Instant now) {
        return evaluate(position, now, thresholds());
    }

    public ExitDecision evaluate(Position position, Instant now, ExitThresholds thresholds) {
        if (position.getPnlPct() == null || position.getCurrentPrice() == null) {
            return ExitDecision.hold("NO_PRICE");
        }
        BigDecimal pnlPct = position.getPnlPct();

        if (pnlPct.compareTo(thresholds.profitTargetPct()) >= 0) {
            return ExitDecision.exit(ExitReason.PROFIT_TARGET, "P&L " + pnlPct + "% >= " + thresholds.profitTargetPct() + "%");
        }

        if (pnlPct.compareTo(thresholds.stopLossPct().negate()) <= 0) {
            return ExitDecision.exit(ExitReason.STOP_LOSS, "P&L " + pnlPct + "% <= -" + thresholds.stopLossPct() + "%");
        }

        if (position.getPeakPrice() != null && position.getPeakPrice().signum() > 0) {
            BigDecimal drawdown = position.drawdownFromPeakPct();
            if (drawdown.compareTo(thresholds.trailingStopPct()) >= 0) {
                return ExitDecision.exit(ExitReason.TRAILING_STOP, "Drawdown " + drawdown + "% from peak " + position.getPeakPrice());
            }
        }

        if (thresholds.maxHold() != null && position.holdTime(now).compareTo(thresholds.maxHold()) > 0) {
            return ExitDecision.exit(ExitReason.MAX_HOLD_TIME, "Held longer than " + thresholds.maxHold());
        }

        return ExitDecision.hold("HOLD");
    }

    public ExitThresholds thresholds() {
        ExecutionProperties.ExitProperties exit = properties.getExit();
        Duration maxHold = exit.getMaxHoldHours() > 0
                ? Duration.ofSeconds(Math.round(exit.getMaxHoldHours() * 3600))
                : null;
        if (exit.getSource() == ExecutionProperties.ThresholdSource.STRATEGY) {
            RiskLimits limits = sizingService.limits();
            return new ExitThresholds(
                    percent(limits.takeProfitFraction() * 100),
                    percent(limits.stopLossFraction() * 100),
                    percent(exit.getTrailingStopPct()),
                    maxHold);
        }
        return new ExitThresholds(
                percent(exit.getProfitTargetPct()),
                percent(exit.getStopLossPct()),
                percent(exit.getTrailingStopPct()),
                maxHold);
    }

    private static BigDecimal percent(double value) {
        return BigDecimal.valueOf(value);
    }

    /**
     * Percent thresholds; a null max hold disables the time exit.
     */
    public record ExitThresholds(BigDecimal profitTargetPct, BigDecimal stopLossPct,
                                 BigDecimal trailingStopPct, Duration maxHold) {
    }

    public record ExitDecision(boolean shouldExit, ExitReason reason, String reasonDetail) {
        public static ExitDecision exit(ExitReason reason, String detail) {
            return new ExitDecision(true, reason, detail);
        }

        public static ExitDecision hold(String detail) {
            return new ExitDecision(false, null, detail);
        }
    }
}
