package com.heist.backend.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordSignalDetected(boolean withAddress) {
        meterRegistry.counter("signals_detected_total", "address", String.valueOf(withAddress)).increment();
    }

    public void recordDuplicateMessage() {
        meterRegistry.counter("messages_duplicate_total").increment();
    }

    public void recordAudit(boolean safe, boolean cached) {
        meterRegistry.counter("audits_total",
                "result", safe ? "safe" : "unsafe",
                "cached", String.valueOf(cached)).increment();
    }

    public void recordCollaboratorFailure(String collaborator) {
        meterRegistry.counter("collaborator_failures_total",
                "collaborator", collaborator == null ? "unknown" : collaborator).increment();
    }

    public void recordTradeOpened() {
        meterRegistry.counter("trades_opened_total").increment();
    }

    public void recordTradeClosed(String reason, boolean win) {
        meterRegistry.counter("trades_closed_total",
                "reason", reason == null ? "unknown" : reason,
                "outcome", win ? "win" : "loss").increment();
    }

    public void recordTradeRejected(String kind) {
        meterRegistry.counter("trades_rejected_total", "kind", kind).increment();
    }

    public void recordTaskFailure(String task) {
        meterRegistry.counter("scheduled_task_failures_total", "task", task).increment();
    }

    public void registerGauge(String name, Supplier<Number> supplier) {
        Gauge.builder(name, supplier, source -> {
                    Number value = source.get();
                    return value == null ? 0.0 : value.doubleValue();
                })
                .register(meterRegistry);
    }
}
