package com.heist.backend.service.audit;

import com.heist.backend.config.AuditProperties;
import com.heist.backend.model.Chain;
import com.heist.backend.model.ContractAudit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Completed audits keyed by chain and address. A hit hands back the stored object itself.
 */
@Component
@RequiredArgsConstructor
public class AuditCache {

    private final AuditProperties properties;
    private final Clock clock;

    private final Map<String, ContractAudit> entries = new ConcurrentHashMap<>();

    public Optional<ContractAudit> get(String address, String chain) {
        String key = key(address, chain);
        ContractAudit audit = entries.get(key);
        if (audit == null) {
            return Optional.empty();
        }
        if (isExpired(audit, clock.instant())) {
            entries.remove(key, audit);
            return Optional.empty();
        }
        return Optional.of(audit);
    }

    public void put(ContractAudit audit) {
        entries.put(key(audit.getAddress(), audit.getChain()), audit);
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(audit -> isExpired(audit, now));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(ContractAudit audit, Instant now) {
        Duration ttl = Duration.ofSeconds(properties.getCacheTtlSeconds());
        return !now.isBefore(audit.getTimestamp().plus(ttl));
    }

    static String key(String address, String chain) {
        String normalizedChain = chain == null ? "" : chain.toLowerCase(Locale.ROOT);
        String normalizedAddress = address == null ? "" : Chain.canonicalAddress(address);
        return normalizedChain + ":" + normalizedAddress;
    }
}
