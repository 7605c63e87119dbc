package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Participant {
    private String competitionId;
    private String userId;
    private String userName;

    private long currentValue;
    private long previousValue;
    private long peakValue;

    private Integer rank;
    private Integer previousRank;
    private Double percentile;

    private long activityCount;

    @Builder.Default
    private Set<String> qualifiedRules = new LinkedHashSet<>();

    private String milestoneReached;
    private Double improvementPercent;
    private Long baselineValue;
    private BaselinePeriod baselinePeriod;
    private Instant baselineCalculatedAt;
    private boolean lotteryQualifier;

    // When current_value was reached; orders equal values
    private Instant valueReachedAt;
    private Instant lastActivityAt;

    private long version;

    public boolean hasQualifiedFor(String ruleId) {
        return qualifiedRules != null && qualifiedRules.contains(ruleId);
    }

    public Participant copy() {
        return toBuilder()
            .qualifiedRules(qualifiedRules == null ? new LinkedHashSet<>() : new LinkedHashSet<>(qualifiedRules))
            .build();
    }
}
