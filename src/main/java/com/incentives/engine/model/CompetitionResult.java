package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable settlement outcome for one (competition, user, rule).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetitionResult {
    private String id;
    private String competitionId;
    private String userId;
    private String userName;
    private String ruleId;
    private RuleType ruleType;

    private int finalRank;
    private long finalValue;
    private double finalPercentile;

    private String qualificationReason;
    private int pointsAwarded;
    private String badgeId;
    private String rewardId;

    private Double improvementAchieved;
    private Long baselineValue;

    @Builder.Default
    private String fulfillmentStatus = "pending";

    private Instant createdAt;
}
