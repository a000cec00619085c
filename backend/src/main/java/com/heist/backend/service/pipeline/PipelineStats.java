package com.heist.backend.service.pipeline;

import com.heist.backend.config.OrchestratorProperties;
import com.heist.backend.model.PipelineDecision;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class PipelineStats {

    private final int decisionHistoryLimit;
    private final Instant startedAt;

    private final AtomicLong signalsProcessed = new AtomicLong();
    private final AtomicLong passedAudit = new AtomicLong();
    private final AtomicLong rejectedAudit = new AtomicLong();
    private final AtomicLong tradesExecuted = new AtomicLong();
    private final AtomicLong tradesFailed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Deque<PipelineDecision> decisions = new ArrayDeque<>();

    public PipelineStats(OrchestratorProperties properties, Clock clock) {
        this.decisionHistoryLimit = properties.getDecisionHistoryLimit();
        this.startedAt = clock.instant();
    }

    public void recordDecision(PipelineDecision decision) {
        switch (decision.outcome()) {
            case REJECTED_AUDIT -> rejectedAudit.incrementAndGet();
            case TRADE_OPENED -> {
                passedAudit.incrementAndGet();
                tradesExecuted.incrementAndGet();
            }
            case TRADE_FAILED -> {
                passedAudit.incrementAndGet();
                tradesFailed.incrementAndGet();
            }
            case ERROR -> errors.incrementAndGet();
        }
        synchronized (decisions) {
            decisions.addFirst(decision);
            while (decisions.size() > decisionHistoryLimit) {
                decisions.removeLast();
            }
        }
    }

    public void recordSignalProcessed() {
        signalsProcessed.incrementAndGet();
    }

    /** Newest first. */
    public List<PipelineDecision> recentDecisions(int limit) {
        synchronized (decisions) {
            List<PipelineDecision> copy = new ArrayList<>(decisions);
            return Collections.unmodifiableList(copy.subList(0, Math.min(Math.max(limit, 0), copy.size())));
        }
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Snapshot snapshot() {
        return new Snapshot(signalsProcessed.get(), passedAudit.get(), rejectedAudit.get(),
                tradesExecuted.get(), tradesFailed.get(), errors.get());
    }

    public record Snapshot(long signalsProcessed, long passedAudit, long rejectedAudit,
                           long tradesExecuted, long tradesFailed, long errors) {
    }
}
