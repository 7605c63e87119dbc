package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MilestoneTier {
    private String tier;
    private long value;
    private int pointsAward;
    private String badgeId;
    private String rewardId;
}
