package com.heist.backend.config;

import com.heist.backend.model.SizingStrategy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    private boolean dryRun = true;

    @NotNull
    private SizingStrategy strategy = SizingStrategy.BALANCED;

    @Positive
    private double walletBalanceUsd = 1000.0;

    /** Open position ceiling; zero falls back to the strategy limit. */
    @Min(0)
    private int maxOpenPositions = 5;

    @Positive
    private int closedHistoryLimit = 1000;

    private ExitProperties exit = new ExitProperties();

    private DryRunProperties dryRunFill = new DryRunProperties();

    @Data
    public static class ExitProperties {
        @NotNull
        private ThresholdSource source = ThresholdSource.CONFIGURED;

        @Positive
        private double profitTargetPct = 500.0;

        @Positive
        private double stopLossPct = 50.0;

        @Positive
        private double trailingStopPct = 20.0;

        /** Zero disables the time exit. */
        @Min(0)
        private double maxHoldHours = 24.0;
    }

    @Data
    public static class DryRunProperties {
        @Positive
        private double entryPrice = 0.00001;

        private double minMovePct = -5.0;

        private double maxMovePct = 15.0;

        /** Fixed seed for the repricing walk; unset means nondeterministic. */
        private Long seed;
    }

    public enum ThresholdSource {
        CONFIGURED,
        STRATEGY
    }
}
