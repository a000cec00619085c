package com.heist.backend.service;

import com.heist.backend.config.SchedulerProperties;
import com.heist.backend.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledTaskGuardTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private EngineLifecycle lifecycle;
    private MutableClock clock;
    private ScheduledTaskGuard guard;

    @BeforeEach
    void setUp() {
        lifecycle = new EngineLifecycle();
        lifecycle.start();
        clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
        guard = new ScheduledTaskGuard(lifecycle, new SchedulerProperties(), new MetricsService(registry), clock);
    }

    @Test
    void skipsWorkOnceStopped() {
        AtomicInteger runs = new AtomicInteger();
        lifecycle.stop();

        assertThat(guard.run("signal-loop", runs::incrementAndGet)).isFalse();
        assertThat(runs).hasValue(0);
    }

    @Test
    void failureBacksOffThenRecovers() {
        AtomicInteger runs = new AtomicInteger();

        boolean failed = guard.run("monitor", () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(failed).isFalse();
        assertThat(guard.isBackingOff("monitor")).isTrue();
        assertThat(registry.counter("scheduled_task_failures_total", "task", "monitor").count()).isEqualTo(1.0);

        assertThat(guard.run("monitor", runs::incrementAndGet)).isFalse();
        assertThat(runs).hasValue(0);

        clock.advance(Duration.ofSeconds(10));
        assertThat(guard.run("monitor", runs::incrementAndGet)).isTrue();
        assertThat(runs).hasValue(1);
        assertThat(guard.isBackingOff("monitor")).isFalse();
    }

    @Test
    void backoffIsPerTask() {
        guard.run("prune", () -> {
            throw new RuntimeException("disk full");
        });

        assertThat(guard.run("signal-loop", () -> { })).isTrue();
    }
}
