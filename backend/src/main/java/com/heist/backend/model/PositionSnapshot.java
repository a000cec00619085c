package com.heist.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PositionSnapshot {

    String id;
    String address;
    String chain;
    String symbol;
    Instant entryTime;
    BigDecimal entryPrice;
    BigDecimal entryAmountUsd;
    BigDecimal tokenAmount;
    String entryTxRef;
    BigDecimal currentPrice;
    BigDecimal currentValueUsd;
    BigDecimal peakPrice;
    Instant exitTime;
    BigDecimal exitPrice;
    BigDecimal exitAmountUsd;
    String exitTxRef;
    ExitReason exitReason;
    BigDecimal pnlUsd;
    BigDecimal pnlPct;
    TradeStatus status;
}
