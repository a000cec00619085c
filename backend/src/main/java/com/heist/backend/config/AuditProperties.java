package com.heist.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "audit")
@Data
@Validated
public class AuditProperties {

    @NotNull
    private Mode mode = Mode.SIMULATION;

    @Min(0)
    @Max(100)
    private double minSafetyScore = 80.0;

    @Min(0)
    private double minLiquidityUsd = 10000.0;

    @Min(0)
    @Max(100)
    private double maxHolderConcentrationPct = 50.0;

    @Min(0)
    private double maxBuyTaxPct = 10.0;

    @Min(0)
    private double maxSellTaxPct = 10.0;

    @Positive
    private long cacheTtlSeconds = 300;

    private Endpoints endpoints = new Endpoints();

    /** Fraction of simulated audits that come back clean. */
    @Min(0)
    @Max(1)
    private double simulatedSafeRatio = 0.8;

    @Data
    public static class Endpoints {
        private String ethereumRpcUrl = "https://eth.llamarpc.com";
        private String honeypotUrl = "https://api.honeypot.is/v2/IsHoneypot";
        private String dextoolsUrl = "https://public-api.dextools.io/trial/v2/token";
        private String dextoolsApiKey = "";
        private String rugcheckUrl = "https://api.rugcheck.xyz/v1/tokens";
    }

    public enum Mode {
        SIMULATION,
        LIVE
    }
}
