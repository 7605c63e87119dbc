package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameEvent {
    private String id;
    private GameEventType type;
    private String userId;
    private Instant ts;

    // Overrides the type's default points when present
    private Integer dispositionPoints;

    // Source references (claim id, pin id, ...); opaque to the engine
    @Builder.Default
    private Map<String, String> payload = new HashMap<>();

    private boolean processed;
    private Instant processedAt;
}
