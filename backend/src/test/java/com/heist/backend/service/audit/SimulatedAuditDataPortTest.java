package com.heist.backend.service.audit;

import com.heist.backend.config.AuditProperties;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedAuditDataPortTest {

    private final AuditProperties properties = new AuditProperties();
    private final SimulatedAuditDataPort port = new SimulatedAuditDataPort(properties);

    @Test
    void answersAreStablePerAddress() {
        String address = "0x6982508145454Ce325dDbE47a25d4ec3d2311933";

        assertThat(port.honeypot(address)).isEqualTo(port.honeypot(address));
        assertThat(port.rugCheck(address)).isEqualTo(port.rugCheck(address));
        assertThat(port.isClean(address)).isEqualTo(port.isClean(address.toLowerCase()));
    }

    @Test
    void cleanAddressesLookClean() {
        String clean = IntStream.range(0, 1000)
                .mapToObj(i -> String.format("0x%040x", i))
                .filter(port::isClean)
                .findFirst()
                .orElseThrow();

        assertThat(port.honeypot(clean).honeypot()).isFalse();
        assertThat(port.honeypot(clean).buyTaxPct()).isLessThanOrEqualTo(3.0);
        assertThat(port.rugCheck(clean).risks()).isEmpty();
        assertThat(port.tokenInfo(clean, "ethereum").orElseThrow().liquidityUsd()).isGreaterThanOrEqualTo(50000.0);
    }

    @Test
    void ratioControlsCleanShare() {
        properties.setSimulatedSafeRatio(0.0);
        assertThat(port.isClean("0x6982508145454Ce325dDbE47a25d4ec3d2311933")).isFalse();

        properties.setSimulatedSafeRatio(1.0);
        assertThat(port.isClean("0x6982508145454Ce325dDbE47a25d4ec3d2311933")).isTrue();
    }
}
