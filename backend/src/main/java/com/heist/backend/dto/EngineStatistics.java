package com.heist.backend.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class EngineStatistics {
    long totalTrades;
    long winningTrades;
    long losingTrades;
    double winRatePct;
    BigDecimal totalPnlUsd;
    int openPositions;
    int closedPositions;
    int pendingBuys;
    long failedBuys;
    long lateFills;
    long unresolvedLateFills;
    BigDecimal walletBalanceUsd;
    boolean dryRun;
}
