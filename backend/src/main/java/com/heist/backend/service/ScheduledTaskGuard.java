package com.heist.backend.service;

import com.heist.backend.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wraps every scheduled loop body. A failing task is logged and then skipped until
 * its backoff window has passed; it is never allowed to kill the scheduler thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final EngineLifecycle engineLifecycle;
    private final SchedulerProperties schedulerProperties;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Map<String, Instant> backoffUntil = new ConcurrentHashMap<>();

    /**
     * @return true when the task ran to completion
     */
    public boolean run(String taskName, Runnable task) {
        if (!engineLifecycle.isRunning()) {
            log.debug("Engine stopped, skipping task={}", taskName);
            return false;
        }
        Instant now = clock.instant();
        Instant until = backoffUntil.get(taskName);
        if (until != null && now.isBefore(until)) {
            log.debug("Task {} backing off until {}", taskName, until);
            return false;
        }
        try {
            task.run();
            backoffUntil.remove(taskName);
            return true;
        } catch (Throwable t) {
            Instant resumeAt = now.plus(Duration.ofMillis(schedulerProperties.getErrorBackoffMs()));
            backoffUntil.put(taskName, resumeAt);
            metricsService.recordTaskFailure(taskName);
            log.error("Scheduled task failed task={} backoffUntil={}", taskName, resumeAt, t);
            return false;
        }
    }

    public boolean isBackingOff(String taskName) {
        Instant until = backoffUntil.get(taskName);
        return until != null && clock.instant().isBefore(until);
    }
}
