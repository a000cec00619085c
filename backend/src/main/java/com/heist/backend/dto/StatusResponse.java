package com.heist.backend.dto;

import com.heist.backend.model.SizingState;
import com.heist.backend.service.pipeline.PipelineStats;
import com.heist.backend.service.signal.SignalDetector;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class StatusResponse {
    private String status;
    private Instant startedAt;
    private long uptimeSeconds;
    private PipelineStats.Snapshot pipeline;
    private EngineStatistics engine;
    private SizingState sizing;
    private SignalDetector.DetectorSnapshot detector;
    private int auditCacheSize;
    private int processedSignalKeys;
}
