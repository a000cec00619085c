package com.heist.backend.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one signal passing through the pipeline.
 */
public record PipelineDecision(
        String signalKey,
        String address,
        String chain,
        Outcome outcome,
        Double safetyScore,
        String positionId,
        List<String> reasons,
        Instant decidedAt
) {

    public enum Outcome {
        REJECTED_AUDIT,
        TRADE_FAILED,
        TRADE_OPENED,
        ERROR
    }
}
