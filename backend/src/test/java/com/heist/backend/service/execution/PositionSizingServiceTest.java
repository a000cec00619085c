package com.heist.backend.service.execution;

import com.heist.backend.config.ExecutionProperties;
import com.heist.backend.model.SizingStrategy;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PositionSizingServiceTest {

    @Test
    void balancedSizeShrinksWithOpenPositions() {
        PositionSizingService service = service(SizingStrategy.BALANCED);

        assertThat(service.positionSize(new BigDecimal("1000"), 0)).isEqualByComparingTo("150");
        assertThat(service.positionSize(new BigDecimal("1000"), 2)).isEqualByComparingTo("120");
        assertThat(service.positionSize(new BigDecimal("1000"), 7)).isEqualByComparingTo("75");
    }

    @Test
    void sizeIsClampedToTradeBounds() {
        PositionSizingService service = service(SizingStrategy.BALANCED);

        assertThat(service.positionSize(new BigDecimal("10"), 0)).isEqualByComparingTo("5");
        assertThat(service.positionSize(new BigDecimal("1000000"), 0)).isEqualByComparingTo("10000");
    }

    @Test
    void adaptiveGrowsOnWinStreak() {
        PositionSizingService service = service(SizingStrategy.ADAPTIVE);
        service.recordTradeResult(0.10);
        service.recordTradeResult(0.10);
        assertThat(service.basePercent()).isCloseTo(0.15, within(1e-9));

        service.recordTradeResult(0.10);

        assertThat(service.basePercent()).isCloseTo(0.24, within(1e-9));
    }

    @Test
    void adaptiveNeverExceedsCeiling() {
        PositionSizingService service = service(SizingStrategy.ADAPTIVE);
        for (int i = 0; i < 8; i++) {
            service.recordTradeResult(0.05);
        }

        assertThat(service.basePercent()).isCloseTo(0.30, within(1e-9));
    }

    @Test
    void adaptiveShrinksOnLossStreak() {
        PositionSizingService service = service(SizingStrategy.ADAPTIVE);
        service.recordTradeResult(-0.01);
        service.recordTradeResult(-0.01);

        assertThat(service.basePercent()).isCloseTo(0.05, within(1e-9));
    }

    @Test
    void adaptiveShrinksNearDailyLossLimit() {
        PositionSizingService service = service(SizingStrategy.ADAPTIVE);
        service.recordTradeResult(-0.06);

        // proximity 0.75 of the 8% limit
        assertThat(service.basePercent()).isCloseTo(0.15 * (1 - 0.75 * 0.3), within(1e-9));
    }

    @Test
    void dailyResetKeepsStreaks() {
        PositionSizingService service = service(SizingStrategy.BALANCED);
        service.recordTradeOpened();
        service.recordTradeResult(-0.05);

        service.resetDaily();

        assertThat(service.state().getTradesToday()).isZero();
        assertThat(service.state().getDailyPnlFraction()).isZero();
        assertThat(service.state().getLossStreak()).isEqualTo(1);
        assertThat(service.state().getTotalTrades()).isEqualTo(1);
    }

    @Test
    void ceilingIsTheStricterOfConfiguredAndStrategy() {
        ExecutionProperties properties = new ExecutionProperties();
        properties.setStrategy(SizingStrategy.CONSERVATIVE);
        properties.setMaxOpenPositions(2);
        assertThat(new PositionSizingService(properties).maxOpenPositions()).isEqualTo(2);

        properties.setMaxOpenPositions(0);
        assertThat(new PositionSizingService(properties).maxOpenPositions()).isEqualTo(5);

        properties.setStrategy(SizingStrategy.BALANCED);
        properties.setMaxOpenPositions(5);
        assertThat(new PositionSizingService(properties).maxOpenPositions()).isEqualTo(4);
    }

    private PositionSizingService service(SizingStrategy strategy) {
        ExecutionProperties properties = new ExecutionProperties();
        properties.setStrategy(strategy);
        return new PositionSizingService(properties);
    }
}
