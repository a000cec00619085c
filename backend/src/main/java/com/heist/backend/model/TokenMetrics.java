package com.heist.backend.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Rolling activity for one token address. Mutated only by the signal detector;
 * everyone else receives a {@link #copy()}.
 */
@Getter
public class TokenMetrics {

    private final String address;
    private int messageCount;
    private long totalHype;
    private final Instant firstSeen;
    private Instant lastSeen;
    private final Set<String> sources = new LinkedHashSet<>();

    public TokenMetrics(String address, Instant firstSeen) {
        this.address = address;
        this.firstSeen = firstSeen;
        this.lastSeen = firstSeen;
    }

    public void record(int hypeScore, String source, Instant seenAt) {
        messageCount++;
        totalHype += hypeScore;
        lastSeen = seenAt;
        sources.add(source);
    }

    public double getAverageHype() {
        return messageCount > 0 ? (double) totalHype / messageCount : 0.0;
    }

    /**
     * Messages per minute between first and last sighting; zero until time has elapsed.
     */
    public double getVelocityPerMinute() {
        double minutes = Duration.between(firstSeen, lastSeen).toMillis() / 60000.0;
        return minutes > 0 ? messageCount / minutes : 0.0;
    }

    public TokenMetrics copy() {
        TokenMetrics copy = new TokenMetrics(address, firstSeen);
        copy.messageCount = messageCount;
        copy.totalHype = totalHype;
        copy.lastSeen = lastSeen;
        copy.sources.addAll(sources);
        return copy;
    }
}
