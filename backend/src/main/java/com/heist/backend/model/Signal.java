package com.heist.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A scored message that either carries a token address or cleared the hype floor.
 */
@Value
@Builder
public class Signal {

    String messageId;
    String platform;
    String channel;
    String text;
    String address;
    String chain;
    int hypeScore;
    Instant timestamp;

    public boolean hasAddress() {
        return address != null && !address.isBlank();
    }

    public String source() {
        return platform + ":" + channel;
    }
}
