package com.heist.backend.model;

import java.util.Locale;
import java.util.Optional;

public enum Chain {
    ETHEREUM("ethereum"),
    SOLANA("solana");

    private final String tag;

    Chain(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<Chain> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Chain chain : values()) {
            if (chain.tag.equals(normalized)) {
                return Optional.of(chain);
            }
        }
        return Optional.empty();
    }

    /**
     * Lookup key for an address. EVM hex addresses are case-insensitive and fold to lower case;
     * base58 addresses are case-sensitive and stay as given.
     */
    public static String canonicalAddress(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        return trimmed;
    }
}
