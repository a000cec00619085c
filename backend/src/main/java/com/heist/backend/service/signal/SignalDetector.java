package com.heist.backend.service.signal;

import com.heist.backend.config.DetectorProperties;
import com.heist.backend.model.Chain;
import com.heist.backend.model.IngestedMessage;
import com.heist.backend.model.Signal;
import com.heist.backend.model.TokenMetrics;
import com.heist.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Turns raw chatter into scored signals and keeps a rolling per-token view.
 * All state is guarded by the instance monitor; ingestion webhooks and the
 * scheduler threads call in concurrently.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignalDetector {

    private final DetectorProperties properties;
    private final HypeScorer hypeScorer;
    private final AddressExtractor addressExtractor;
    private final MetricsService metricsService;
    private final Clock clock;

    private final List<Signal> window = new ArrayList<>();
    private final Map<String, TokenMetrics> metricsByAddress = new HashMap<>();
    private final Map<String, Instant> seenMessageIds = new LinkedHashMap<>();

    private long messagesReceived;
    private long duplicatesDropped;
    private long signalsEmitted;

    /**
     * Entry point for ingestion collaborators. Redelivered message ids are dropped.
     */
    public synchronized Optional<Signal> ingest(IngestedMessage message) {
        if (message == null || message.text() == null || message.text().isBlank()) {
            return Optional.empty();
        }
        messagesReceived++;
        String platform = orUnknown(message.platform());
        String channel = orUnknown(message.channel());
        String messageId = message.messageId() != null && !message.messageId().isBlank()
                ? platform + ":" + message.messageId()
                : deriveMessageId(platform, channel, message.text());
        if (seenMessageIds.containsKey(messageId)) {
            duplicatesDropped++;
            metricsService.recordDuplicateMessage();
            log.debug("Duplicate message dropped id={}", messageId);
            return Optional.empty();
        }
        seenMessageIds.put(messageId, clock.instant());
        return extract(message.text(), platform, channel, messageId);
    }

    public synchronized Optional<Signal> extract(String text, String platform, String channel) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String safePlatform = orUnknown(platform);
        String safeChannel = orUnknown(channel);
        return extract(text, safePlatform, safeChannel, deriveMessageId(safePlatform, safeChannel, text));
    }

    private Optional<Signal> extract(String text, String platform, String channel, String messageId) {
        int hype = hypeScorer.score(text);
        Optional<AddressExtractor.ExtractedAddress> extracted = addressExtractor.extract(text);
        if (extracted.isEmpty() && hype < properties.getMinHypeScore()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Signal signal = Signal.builder()
                .messageId(messageId)
                .platform(platform)
                .channel(channel)
                .text(truncate(text, properties.getMaxTextLength()))
                .address(extracted.map(AddressExtractor.ExtractedAddress::address).orElse(null))
                .chain(extracted.map(found -> found.chain().tag()).orElse(null))
                .hypeScore(hype)
                .timestamp(now)
                .build();
        window.add(signal);
        signalsEmitted++;
        if (signal.hasAddress()) {
            String key = Chain.canonicalAddress(signal.getAddress());
            metricsByAddress
                    .computeIfAbsent(key, address -> new TokenMetrics(address, now))
                    .record(hype, signal.source(), now);
        }
        metricsService.recordSignalDetected(signal.hasAddress());
        log.info("🎯 Signal detected score={} platform={} channel={} address={}",
                hype, platform, channel, signal.hasAddress() ? signal.getAddress() : "N/A");
        return Optional.of(signal);
    }

    /**
     * Highest hype first; equal scores list the newest signal first.
     */
    public List<Signal> topSignals(int limit) {
        return topSignals(limit, signal -> true);
    }

    /**
     * Same ordering as {@link #topSignals(int)}, ranked only among signals the filter accepts.
     */
    public synchronized List<Signal> topSignals(int limit, Predicate<Signal> filter) {
        if (limit <= 0 || window.isEmpty()) {
            return List.of();
        }
        List<Signal> newestFirst = new ArrayList<>();
        for (Signal signal : window) {
            if (filter.test(signal)) {
                newestFirst.add(signal);
            }
        }
        Collections.reverse(newestFirst);
        newestFirst.sort(Comparator.comparingInt(Signal::getHypeScore).reversed()
                .thenComparing(Signal::getTimestamp, Comparator.reverseOrder()));
        return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
    }

    public synchronized Optional<TokenMetrics> metrics(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(metricsByAddress.get(Chain.canonicalAddress(address))).map(TokenMetrics::copy);
    }

    /**
     * Drops signals, token metrics and seen ids older than the rolling window.
     *
     * @return number of signals removed
     */
    public synchronized int prune() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getWindowHours()));
        int before = window.size();
        window.removeIf(signal -> !signal.getTimestamp().isAfter(cutoff));
        metricsByAddress.values().removeIf(metrics -> !metrics.getLastSeen().isAfter(cutoff));
        seenMessageIds.values().removeIf(seenAt -> !seenAt.isAfter(cutoff));
        int removed = before - window.size();
        if (removed > 0) {
            log.debug("Pruned {} signals older than {}", removed, cutoff);
        }
        return removed;
    }

    public synchronized DetectorSnapshot snapshot() {
        return new DetectorSnapshot(messagesReceived, duplicatesDropped, signalsEmitted,
                window.size(), metricsByAddress.size());
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }

    private static String truncate(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    static String deriveMessageId(String platform, String channel, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((platform + "\u0000" + channel + "\u0000" + text)
                    .getBytes(StandardCharsets.UTF_8));
            return platform + ":" + HexFormat.of().formatHex(hash, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public record DetectorSnapshot(long messagesReceived, long duplicatesDropped, long signalsEmitted,
                                   int windowSize, int trackedTokens) {
    }
}
