package com.heist.backend.event;

import com.heist.backend.model.PositionSnapshot;

import java.time.Instant;

public record PositionOpenedEvent(
        PositionSnapshot position,
        Double safetyScore,
        Instant createdAt
) {
}
