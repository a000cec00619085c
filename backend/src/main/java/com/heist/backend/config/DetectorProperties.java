package com.heist.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "detector")
@Data
@Validated
public class DetectorProperties {

    /** Signals without an address are only emitted at or above this hype score. */
    @Min(0)
    private int minHypeScore = 70;

    @Positive
    private int maxTextLength = 500;

    /** Rolling window for signals, token metrics and seen message ids. */
    @Positive
    private int windowHours = 24;
}
