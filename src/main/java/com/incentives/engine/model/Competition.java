package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Competition {
    private String id;
    private String name;
    private String metricId;
    private String seasonId;
    private CompetitionStatus status;
    private Integer participantCount;
    private Integer qualifiedCount;
    private Instant evaluationStartedAt;
    private Instant evaluatedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
