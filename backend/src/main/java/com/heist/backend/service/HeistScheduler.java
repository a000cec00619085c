package com.heist.backend.service;

import com.heist.backend.service.audit.AuditCache;
import com.heist.backend.service.execution.ExecutionEngine;
import com.heist.backend.service.pipeline.PipelineOrchestrator;
import com.heist.backend.service.pipeline.StatusReporter;
import com.heist.backend.service.signal.SignalDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * The engine's loops. Each runs with a fixed delay so it never overlaps itself,
 * and each goes through {@link ScheduledTaskGuard} for the stop flag and error backoff.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HeistScheduler {

    static final String SIGNAL_LOOP = "signal-loop";
    static final String POSITION_MONITOR = "position-monitor";
    static final String STATUS_REPORT = "status-report";
    static final String PRUNE = "prune";
    static final String DAILY_RESET = "daily-reset";

    private final ScheduledTaskGuard taskGuard;
    private final EngineLifecycle engineLifecycle;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final ExecutionEngine executionEngine;
    private final SignalDetector signalDetector;
    private final AuditCache auditCache;
    private final StatusReporter statusReporter;

    @Scheduled(fixedDelayString = "${scheduler.signal-interval-ms:5000}")
    public void runSignalLoop() {
        taskGuard.run(SIGNAL_LOOP, () -> {
            int decided = pipelineOrchestrator.processSignals();
            if (decided > 0) {
                log.debug("Signal loop decided {} signals", decided);
            }
        });
    }

    @Scheduled(fixedDelayString = "${scheduler.monitor-interval-ms:5000}")
    public void runPositionMonitor() {
        taskGuard.run(POSITION_MONITOR, () -> {
            ExecutionEngine.MonitorSummary summary = executionEngine.monitorPositions();
            if (summary.open() > 0) {
                log.debug("Monitor pass open={} evaluated={} closed={} failures={}",
                        summary.open(), summary.evaluated(), summary.closed(), summary.failures());
            }
        });
    }

    @Scheduled(fixedDelayString = "${scheduler.status-interval-ms:300000}",
            initialDelayString = "${scheduler.status-interval-ms:300000}")
    public void runStatusReport() {
        taskGuard.run(STATUS_REPORT, statusReporter::report);
    }

    @Scheduled(fixedDelayString = "${scheduler.prune-interval-ms:5000}")
    public void runPrune() {
        taskGuard.run(PRUNE, () -> {
            signalDetector.prune();
            auditCache.evictExpired();
        });
    }

    @Scheduled(cron = "${scheduler.daily-reset-cron:0 0 0 * * *}")
    public void resetDaily() {
        taskGuard.run(DAILY_RESET, executionEngine::resetDailyStats);
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        engineLifecycle.stop();
        try {
            statusReporter.reportFinal();
        } catch (RuntimeException e) {
            log.warn("Final statistics unavailable: {}", e.getMessage());
        }
    }
}
