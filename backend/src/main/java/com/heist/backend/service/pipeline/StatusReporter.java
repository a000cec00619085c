package com.heist.backend.service.pipeline;

import com.heist.backend.dto.EngineStatistics;
import com.heist.backend.dto.StatusResponse;
import com.heist.backend.service.EngineLifecycle;
import com.heist.backend.service.audit.AuditCache;
import com.heist.backend.service.execution.ExecutionEngine;
import com.heist.backend.service.execution.PositionSizingService;
import com.heist.backend.service.notification.NotificationService;
import com.heist.backend.service.signal.SignalDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class StatusReporter {

    private final PipelineStats pipelineStats;
    private final ExecutionEngine executionEngine;
    private final PositionSizingService sizingService;
    private final SignalDetector signalDetector;
    private final AuditCache auditCache;
    private final ProcessedSignalRegistry processedSignals;
    private final EngineLifecycle engineLifecycle;
    private final NotificationService notificationService;
    private final Clock clock;

    public StatusResponse status() {
        return StatusResponse.builder()
                .status(engineLifecycle.isRunning() ? "RUNNING" : "STOPPED")
                .startedAt(pipelineStats.startedAt())
                .uptimeSeconds(Duration.between(pipelineStats.startedAt(), clock.instant()).getSeconds())
                .pipeline(pipelineStats.snapshot())
                .engine(executionEngine.statistics())
                .sizing(sizingService.state())
                .detector(signalDetector.snapshot())
                .auditCacheSize(auditCache.size())
                .processedSignalKeys(processedSignals.size())
                .build();
    }

    /**
     * Periodic summary to the log and the notification channels.
     */
    public StatusResponse report() {
        StatusResponse status = status();
        String summary = summarize(status);
        log.info("📊 STATUS REPORT\n{}", summary);
        notificationService.notify("📊 Status Report\n" + summary);
        return status;
    }

    public void reportFinal() {
        log.info("📊 FINAL STATISTICS\n{}", summarize(status()));
    }

    static String summarize(StatusResponse status) {
        PipelineStats.Snapshot pipeline = status.getPipeline();
        EngineStatistics engine = status.getEngine();
        Duration uptime = Duration.ofSeconds(status.getUptimeSeconds());
        return String.format(
                "Uptime: %dh %dm%nSignals processed: %d%nPassed audit: %d%nRejected: %d%nTrades executed: %d%n"
                        + "Open positions: %d%nClosed positions: %d%nWin rate: %.1f%%%nTotal P&L: $%s",
                uptime.toHours(), uptime.toMinutesPart(),
                pipeline.signalsProcessed(), pipeline.passedAudit(), pipeline.rejectedAudit(),
                pipeline.tradesExecuted(),
                engine.getOpenPositions(), engine.getClosedPositions(), engine.getWinRatePct(),
                engine.getTotalPnlUsd());
    }
}
