package com.heist.backend.service.audit;

import com.heist.backend.config.AuditProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * Fabricates collaborator answers from the address so repeated audits of one token
 * agree. Roughly {@code simulatedSafeRatio} of addresses come back clean.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "audit", name = "mode", havingValue = "SIMULATION", matchIfMissing = true)
public class SimulatedAuditDataPort implements AuditDataPort {

    private final AuditProperties properties;

    @Override
    public boolean hasContractCode(String address) {
        return true;
    }

    @Override
    public HoneypotReport honeypot(String address) {
        Random random = randomFor(address);
        if (isClean(address)) {
            return new HoneypotReport(false, random.nextInt(4), random.nextInt(4));
        }
        boolean honeypot = random.nextBoolean();
        return new HoneypotReport(honeypot, 20, honeypot ? 99 : 20);
    }

    @Override
    public Optional<TokenInfo> tokenInfo(String address, String chain) {
        Random random = randomFor(address);
        boolean clean = isClean(address);
        double liquidity = clean ? 50000 + random.nextDouble() * 450000 : 500 + random.nextDouble() * 5000;
        double topHolder = clean ? 5 + random.nextDouble() * 25 : 60 + random.nextDouble() * 35;
        String symbol = "SIM" + address.substring(Math.max(0, address.length() - 4)).toUpperCase(Locale.ROOT);
        return Optional.of(new TokenInfo("Simulated " + symbol, symbol, "1000000000",
                liquidity, topHolder, clean ? 500 + random.nextInt(5000) : 10 + random.nextInt(40)));
    }

    @Override
    public RugCheckReport rugCheck(String address) {
        Random random = randomFor(address);
        if (isClean(address)) {
            return new RugCheckReport(90 + random.nextInt(11), List.of());
        }
        return new RugCheckReport(random.nextInt(40), List.of(
                new RugCheckReport.Risk("Mint Authority still enabled", "danger",
                        "More tokens can be minted by the owner"),
                new RugCheckReport.Risk("Low Liquidity", "warn", "Liquidity is thin for this market")));
    }

    boolean isClean(String address) {
        int bucket = Math.floorMod(normalize(address).hashCode(), 100);
        return bucket < Math.round(properties.getSimulatedSafeRatio() * 100);
    }

    private Random randomFor(String address) {
        return new Random(normalize(address).hashCode());
    }

    private static String normalize(String address) {
        return address == null ? "" : address.toLowerCase(Locale.ROOT);
    }
}
