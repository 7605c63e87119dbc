package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricEvent {
    private String id;
    private String userId;
    private String metricId;
    private long value;
    private String eventType;
    private String sourceRef;

    @Builder.Default
    private List<String> competitionIds = new ArrayList<>();

    private Instant createdAt;
}
