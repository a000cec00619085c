package com.heist.backend.service.signal;

import com.heist.backend.model.Chain;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class AddressExtractor {

    static final Pattern ETHEREUM_ADDRESS = Pattern.compile("0x[a-fA-F0-9]{40}");
    static final Pattern SOLANA_ADDRESS = Pattern.compile("[1-9A-HJ-NP-Za-km-z]{32,44}");

    /**
     * First Ethereum-style match wins; otherwise the first base58 match is read as Solana.
     */
    public Optional<ExtractedAddress> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher eth = ETHEREUM_ADDRESS.matcher(text);
        if (eth.find()) {
            return Optional.of(new ExtractedAddress(eth.group(), Chain.ETHEREUM));
        }
        Matcher sol = SOLANA_ADDRESS.matcher(text);
        if (sol.find()) {
            return Optional.of(new ExtractedAddress(sol.group(), Chain.SOLANA));
        }
        return Optional.empty();
    }

    public boolean isEthereumAddress(String address) {
        return address != null && ETHEREUM_ADDRESS.matcher(address).matches();
    }

    public boolean isSolanaAddress(String address) {
        return address != null && SOLANA_ADDRESS.matcher(address).matches();
    }

    public record ExtractedAddress(String address, Chain chain) {
    }
}
