package com.heist.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "orchestrator")
@Data
@Validated
public class OrchestratorProperties {

    @Positive
    private int batchSize = 10;

    @Positive
    private int processedCapacity = 1000;

    @Positive
    private int decisionHistoryLimit = 200;

    private boolean notifyOnOpen = true;

    private boolean notifyOnClose = true;
}
