package com.heist.backend.model;

import com.heist.backend.util.MoneyUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Engine-owned mutable position. Leaves the engine only as a {@link PositionSnapshot}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String address;
    private String chain;
    private String symbol;

    private Instant entryTime;
    private BigDecimal entryPrice;
    private BigDecimal entryAmountUsd;
    private BigDecimal tokenAmount;
    private String entryTxRef;

    private BigDecimal currentPrice;
    private BigDecimal currentValueUsd;
    private BigDecimal peakPrice;

    private Instant exitTime;
    private BigDecimal exitPrice;
    private BigDecimal exitAmountUsd;
    private String exitTxRef;
    private ExitReason exitReason;

    private BigDecimal pnlUsd;
    private BigDecimal pnlPct;

    @Builder.Default
    private TradeStatus status = TradeStatus.PENDING;

    /**
     * Marks to market. Peak price never decreases.
     */
    public void updatePrice(BigDecimal price) {
        BigDecimal scaled = MoneyUtils.price(price);
        currentPrice = scaled;
        currentValueUsd = MoneyUtils.multiply(tokenAmount, scaled);
        if (peakPrice == null || scaled.compareTo(peakPrice) > 0) {
            peakPrice = scaled;
        }
        pnlUsd = MoneyUtils.subtract(currentValueUsd, entryAmountUsd);
        pnlPct = MoneyUtils.percentChange(currentValueUsd, entryAmountUsd);
    }

    public BigDecimal drawdownFromPeakPct() {
        return MoneyUtils.drawdownPercent(peakPrice, currentPrice);
    }

    public Duration holdTime(Instant now) {
        if (entryTime == null) {
            return Duration.ZERO;
        }
        Instant end = exitTime != null ? exitTime : now;
        return Duration.between(entryTime, end);
    }

    public PositionSnapshot snapshot() {
        return PositionSnapshot.builder()
                .id(id)
                .address(address)
                .chain(chain)
                .symbol(symbol)
                .entryTime(entryTime)
                .entryPrice(entryPrice)
                .entryAmountUsd(entryAmountUsd)
                .tokenAmount(tokenAmount)
                .entryTxRef(entryTxRef)
                .currentPrice(currentPrice)
                .currentValueUsd(currentValueUsd)
                .peakPrice(peakPrice)
                .exitTime(exitTime)
                .exitPrice(exitPrice)
                .exitAmountUsd(exitAmountUsd)
                .exitTxRef(exitTxRef)
                .exitReason(exitReason)
                .pnlUsd(pnlUsd)
                .pnlPct(pnlPct)
                .status(status)
                .build();
    }
}
