package com.heist.backend.service.audit;

import com.heist.backend.config.AuditProperties;
import com.heist.backend.exception.CollaboratorException;
import com.heist.backend.model.Chain;
import com.heist.backend.model.ContractAudit;
import com.heist.backend.model.RiskLevel;
import com.heist.backend.model.SecurityCheck;
import com.heist.backend.service.CollaboratorGuard;
import com.heist.backend.service.MetricsService;
import com.heist.backend.service.signal.AddressExtractor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs every applicable security check for a token, then folds the results into a
 * mean score, a risk tier and a safe-to-trade verdict.
 * <p>
 * The verdict needs all three: mean at or above the floor, no failed CRITICAL check,
 * and an explicit non-honeypot answer from a collaborator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContractAuditor {

    static final String AUDIT_ERROR = "Audit Error";

    private final AuditDataPort auditDataPort;
    private final AuditCache auditCache;
    private final AuditProperties properties;
    private final AddressExtractor addressExtractor;
    private final CollaboratorGuard collaboratorGuard;
    private final CircuitBreaker auditCircuitBreaker;
    private final MetricsService metricsService;
    private final Clock clock;

    public ContractAudit audit(String address, String chain) {
        Optional<ContractAudit> cached = auditCache.get(address, chain);
        if (cached.isPresent()) {
            log.info("📋 Returning cached audit chain={} address={}", chain, address);
            metricsService.recordAudit(cached.get().isSafe(), true);
            return cached.get();
        }
        log.info("🔍 Auditing {} contract {}", chain, address);

        Optional<Chain> supported = Chain.fromTag(chain);
        if (supported.isEmpty()) {
            log.error("❌ Unsupported chain: {}", chain);
            return finish(baseAudit(address, chain), false);
        }

        AuditWork work = new AuditWork(baseAudit(address, supported.get().tag()));
        boolean completed = true;
        try {
            switch (supported.get()) {
                case ETHEREUM -> auditEthereum(work, address);
                case SOLANA -> auditSolana(work, address);
            }
        } catch (RuntimeException e) {
            log.error("❌ Audit failed address={} chain={}", address, chain, e);
            work.builder.check(SecurityCheck.failed(AUDIT_ERROR, 0, String.valueOf(e.getMessage()), RiskLevel.CRITICAL));
            completed = false;
        }
        return finish(work.builder, completed && work.cacheable);
    }

    public Optional<ContractAudit> cached(String address, String chain) {
        return auditCache.get(address, chain);
    }

    public boolean quickCheck(String address, String chain) {
        return audit(address, chain).isSafe();
    }

    private void auditEthereum(AuditWork work, String address) {
        if (!addressExtractor.isEthereumAddress(address)) {
            work.builder.check(SecurityCheck.failed("Address Validation", 0, "Invalid Ethereum address", RiskLevel.CRITICAL));
            work.cacheable = false;
            return;
        }

        guarded(work, "Contract Existence", "ethereum-rpc", () -> auditDataPort.hasContractCode(address))
                .ifPresent(hasCode -> work.builder.check(hasCode
                        ? SecurityCheck.passed("Contract Existence", 100, "Contract code verified", RiskLevel.LOW)
                        : SecurityCheck.failed("Contract Existence", 0, "No contract code at this address", RiskLevel.CRITICAL)));

        guarded(work, "Honeypot API", "honeypot", () -> auditDataPort.honeypot(address))
                .ifPresent(report -> applyHoneypot(work, report));

        tokenInfo(work, address, Chain.ETHEREUM.tag());
    }

    private void auditSolana(AuditWork work, String address) {
        if (!addressExtractor.isSolanaAddress(address)) {
            work.builder.check(SecurityCheck.failed("Address Validation", 0, "Invalid Solana address", RiskLevel.CRITICAL));
            work.cacheable = false;
            return;
        }

        guarded(work, "RugCheck API", "rugcheck", () -> auditDataPort.rugCheck(address))
                .ifPresent(report -> applyRugCheck(work, report));

        tokenInfo(work, address, Chain.SOLANA.tag());
    }

    private void applyHoneypot(AuditWork work, AuditDataPort.HoneypotReport report) {
        boolean honeypot = report.honeypot();
        work.builder.honeypot(honeypot);
        work.builder.check(honeypot
                ? SecurityCheck.failed("Honeypot Check", 0, "HONEYPOT DETECTED", RiskLevel.CRITICAL)
                : SecurityCheck.passed("Honeypot Check", 100, "Not a honeypot", RiskLevel.LOW));

        work.builder.buyTaxPct(report.buyTaxPct());
        work.builder.sellTaxPct(report.sellTaxPct());
        work.builder.check(taxCheck("Buy Tax", report.buyTaxPct(), properties.getMaxBuyTaxPct()));
        work.builder.check(taxCheck("Sell Tax", report.sellTaxPct(), properties.getMaxSellTaxPct()));
    }

    static SecurityCheck taxCheck(String name, double taxPct, double maxPct) {
        double score = 100 - Math.min(taxPct * 5, 100);
        RiskLevel severity = taxPct > 20 ? RiskLevel.HIGH : RiskLevel.MEDIUM;
        return new SecurityCheck(name, taxPct <= maxPct, score, String.format("%s: %.2f%%", name, taxPct), severity);
    }

    private void applyRugCheck(AuditWork work, AuditDataPort.RugCheckReport report) {
        List<AuditDataPort.RugCheckReport.Risk> risks = report.risks() == null ? List.of() : report.risks();
        boolean clean = report.score() >= 50 && risks.isEmpty();
        work.builder.check(new SecurityCheck("RugCheck Analysis", clean, report.score(),
                String.format("RugCheck score: %.0f, Risks: %d", report.score(), risks.size()),
                clean ? RiskLevel.LOW : RiskLevel.HIGH));

        boolean critical = false;
        for (AuditDataPort.RugCheckReport.Risk risk : risks) {
            RiskLevel severity = RiskLevel.fromLabel(risk.level());
            critical |= severity == RiskLevel.CRITICAL;
            work.builder.check(SecurityCheck.failed(risk.name(), 0, risk.description(), severity));
        }
        // RugCheck has no honeypot probe; a report without critical risks is the clean verdict
        work.builder.honeypot(critical);
    }

    private void tokenInfo(AuditWork work, String address, String chain) {
        guarded(work, "Token Info API", "token-info", () -> auditDataPort.tokenInfo(address, chain))
                .flatMap(info -> info)
                .ifPresent(info -> {
                    work.builder.tokenName(info.name())
                            .tokenSymbol(info.symbol())
                            .totalSupply(info.totalSupply())
                            .liquidityUsd(info.liquidityUsd())
                            .topHolderPct(info.topHolderPct())
                            .holderCount(info.holderCount());

                    boolean liquidityOk = info.liquidityUsd() >= properties.getMinLiquidityUsd();
                    work.builder.check(new SecurityCheck("Liquidity", liquidityOk,
                            Math.min(info.liquidityUsd() / 1000, 100),
                            String.format("$%,.2f liquidity", info.liquidityUsd()),
                            liquidityOk ? RiskLevel.LOW : RiskLevel.HIGH));

                    if (info.topHolderPct() != null) {
                        double top = info.topHolderPct();
                        boolean concentrationOk = top <= properties.getMaxHolderConcentrationPct();
                        work.builder.check(new SecurityCheck("Holder Concentration", concentrationOk,
                                Math.max(0, 100 - top),
                                String.format("Top holder owns %.2f%%", top),
                                concentrationOk ? RiskLevel.LOW : RiskLevel.HIGH));
                    }
                });
    }

    /**
     * A failed collaborator call costs partial credit instead of the whole audit.
     */
    private <T> Optional<T> guarded(AuditWork work, String checkName, String collaborator, Supplier<T> call) {
        try {
            return Optional.ofNullable(collaboratorGuard.call(collaborator, auditCircuitBreaker, call));
        } catch (CollaboratorException e) {
            log.warn("{} unavailable: {}", checkName, e.getMessage());
            work.builder.check(SecurityCheck.failed(checkName, 50, "API error: " + e.getMessage(), RiskLevel.MEDIUM));
            return Optional.empty();
        }
    }

    private ContractAudit.ContractAuditBuilder baseAudit(String address, String chain) {
        return ContractAudit.builder()
                .address(address)
                .chain(chain)
                .timestamp(clock.instant())
                .honeypot(true);
    }

    private ContractAudit finish(ContractAudit.ContractAuditBuilder builder, boolean cacheable) {
        ContractAudit draft = builder.build();
        List<SecurityCheck> checks = draft.getChecks();
        double score = checks.isEmpty()
                ? 0.0
                : checks.stream().mapToDouble(SecurityCheck::score).sum() / checks.size();
        boolean safe = !checks.isEmpty()
                && score >= properties.getMinSafetyScore()
                && !draft.hasCriticalFailure()
                && !draft.isHoneypot();
        ContractAudit audit = draft.toBuilder()
                .safetyScore(score)
                .riskLevel(checks.isEmpty() ? RiskLevel.CRITICAL : RiskLevel.fromScore(score))
                .safe(safe)
                .build();
        if (cacheable) {
            auditCache.put(audit);
        }
        metricsService.recordAudit(safe, false);
        log.info("{} Audit complete | Score: {}/100 | Risk: {} | Token: {}",
                safe ? "✅" : "❌", String.format("%.1f", score), audit.getRiskLevel(),
                audit.getTokenSymbol() == null ? "Unknown" : audit.getTokenSymbol());
        return audit;
    }

    private static final class AuditWork {
        private final ContractAudit.ContractAuditBuilder builder;
        private boolean cacheable = true;

        private AuditWork(ContractAudit.ContractAuditBuilder builder) {
            this.builder = builder;
        }
    }
}
