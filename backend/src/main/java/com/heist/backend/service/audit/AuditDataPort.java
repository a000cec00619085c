package com.heist.backend.service.audit;

import java.util.List;
import java.util.Optional;

/**
 * Outbound boundary of the contract auditor. Implementations may block; callers
 * wrap every method in a timeout and circuit breaker.
 */
public interface AuditDataPort {

    /** Whether deployed bytecode exists at an Ethereum address. */
    boolean hasContractCode(String address);

    HoneypotReport honeypot(String address);

    /** Market and holder data; empty when no data source is configured. */
    Optional<TokenInfo> tokenInfo(String address, String chain);

    RugCheckReport rugCheck(String address);

    record HoneypotReport(boolean honeypot, double buyTaxPct, double sellTaxPct) {
    }

    record TokenInfo(String name, String symbol, String totalSupply, double liquidityUsd,
                     Double topHolderPct, Integer holderCount) {
    }

    record RugCheckReport(double score, List<Risk> risks) {

        public record Risk(String name, String level, String description) {
        }
    }
}
