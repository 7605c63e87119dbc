package com.incentives.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {
    private String userId;
    private String userName;
    private int rank;
    private long value;
    private Double percentile;
    private long activityCount;
    private boolean inPrizePosition;

    // Distance to the lowest threshold rule not yet reached; null when none remains
    private Long gapToQualify;
}
