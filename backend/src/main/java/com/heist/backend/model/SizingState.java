package com.heist.backend.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SizingState {

    SizingStrategy strategy;
    int tradesToday;
    int totalTrades;
    int winStreak;
    int lossStreak;
    /** Sum of closed-trade returns today as fractions (-0.05 = -5%). */
    double dailyPnlFraction;
    double currentBasePercent;
}
