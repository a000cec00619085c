package com.heist.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class ContractAudit {

    String address;
    String chain;
    Instant timestamp;
    @Singular
    List<SecurityCheck> checks;
    double safetyScore;
    RiskLevel riskLevel;
    boolean safe;
    boolean honeypot;

    Double liquidityUsd;
    Double buyTaxPct;
    Double sellTaxPct;
    Double topHolderPct;
    Integer holderCount;

    String tokenName;
    String tokenSymbol;
    String totalSupply;

    public List<SecurityCheck> failedChecks() {
        return checks.stream().filter(check -> !check.passed()).toList();
    }

    public boolean hasCriticalFailure() {
        return checks.stream().anyMatch(SecurityCheck::isCriticalFailure);
    }
}
