package com.heist.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Data
@Validated
public class SchedulerProperties {

    @Positive
    private long signalIntervalMs = 5000;

    @Positive
    private long monitorIntervalMs = 5000;

    @Positive
    private long statusIntervalMs = 300000;

    @Positive
    private long pruneIntervalMs = 5000;

    @Positive
    private long errorBackoffMs = 10000;

    private String dailyResetCron = "0 0 0 * * *";
}
