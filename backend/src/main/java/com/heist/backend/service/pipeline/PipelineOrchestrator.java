package com.heist.backend.service.pipeline;

import com.heist.backend.config.OrchestratorProperties;
import com.heist.backend.event.PositionOpenedEvent;
import com.heist.backend.model.ContractAudit;
import com.heist.backend.model.PipelineDecision;
import com.heist.backend.model.SecurityCheck;
import com.heist.backend.model.Signal;
import com.heist.backend.service.audit.ContractAuditor;
import com.heist.backend.service.execution.ExecutionEngine;
import com.heist.backend.service.execution.TradeResult;
import com.heist.backend.service.signal.SignalDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Signal to audit to trade. Each signal is taken at most once per address and timestamp.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final SignalDetector signalDetector;
    private final ContractAuditor contractAuditor;
    private final ExecutionEngine executionEngine;
    private final ProcessedSignalRegistry processedSignals;
    private final PipelineStats pipelineStats;
    private final OrchestratorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Drains the current top signals. One signal failing never stops the batch.
     *
     * @return decisions made in this pass
     */
    public int processSignals() {
        List<Signal> batch = signalDetector.topSignals(properties.getBatchSize(), this::isPending);
        int decided = 0;
        for (Signal signal : batch) {
            try {
                if (processSignal(signal).isPresent()) {
                    decided++;
                }
            } catch (RuntimeException e) {
                log.error("❌ Error processing signal address={}", signal.getAddress(), e);
                pipelineStats.recordDecision(new PipelineDecision(ProcessedSignalRegistry.keyOf(signal),
                        signal.getAddress(), signal.getChain(), PipelineDecision.Outcome.ERROR,
                        null, null, List.of(String.valueOf(e.getMessage())), clock.instant()));
            }
        }
        return decided;
    }

    /**
     * @return empty when the signal has no address or was already taken
     */
    public Optional<PipelineDecision> processSignal(Signal signal) {
        if (signal == null || !signal.hasAddress()) {
            return Optional.empty();
        }
        String key = ProcessedSignalRegistry.keyOf(signal);
        if (!processedSignals.markIfNew(key)) {
            return Optional.empty();
        }
        MDC.put("signalKey", key);
        try {
            pipelineStats.recordSignalProcessed();
            log.info("🎯 NEW SIGNAL | Score: {} | Address: {} | Chain: {}",
                    signal.getHypeScore(), signal.getAddress(), signal.getChain());

            ContractAudit audit = contractAuditor.audit(signal.getAddress(), signal.getChain());
            if (!audit.isSafe()) {
                List<String> reasons = audit.failedChecks().stream()
                        .map(check -> check.name() + ": " + check.detail())
                        .toList();
                log.warn("⚠️ REJECTED | Safety Score: {}", String.format("%.1f", audit.getSafetyScore()));
                for (SecurityCheck check : audit.failedChecks()) {
                    log.warn("   ❌ {}: {}", check.name(), check.detail());
                }
                return Optional.of(record(key, signal, PipelineDecision.Outcome.REJECTED_AUDIT, audit, null, reasons));
            }

            log.info("✅ PASSED AUDIT | Safety Score: {}", String.format("%.1f", audit.getSafetyScore()));
            String symbol = audit.getTokenSymbol() != null ? audit.getTokenSymbol() : "UNKNOWN";
            TradeResult result = executionEngine.buy(signal.getAddress(), signal.getChain(), symbol, null);
            if (!result.success()) {
                log.warn("❌ Trade failed ({}): {}", result.failureKind(), result.message());
                return Optional.of(record(key, signal, PipelineDecision.Outcome.TRADE_FAILED, audit, null,
                        List.of(result.failureKind() + ": " + result.message())));
            }

            log.info("🚀 TRADE EXECUTED | position={}", result.position().getId());
            eventPublisher.publishEvent(new PositionOpenedEvent(result.position(), audit.getSafetyScore(), clock.instant()));
            return Optional.of(record(key, signal, PipelineDecision.Outcome.TRADE_OPENED, audit,
                    result.position().getId(), List.of()));
        } finally {
            MDC.remove("signalKey");
        }
    }

    // ranked among untaken addressed signals so spent high-hype entries cannot starve newer ones
    private boolean isPending(Signal signal) {
        return signal.hasAddress() && !processedSignals.contains(ProcessedSignalRegistry.keyOf(signal));
    }

    private PipelineDecision record(String key, Signal signal, PipelineDecision.Outcome outcome, ContractAudit audit,
                                    String positionId, List<String> reasons) {
        PipelineDecision decision = new PipelineDecision(key, signal.getAddress(), signal.getChain(), outcome,
                audit.getSafetyScore(), positionId, reasons, clock.instant());
        pipelineStats.recordDecision(decision);
        return decision;
    }
}
