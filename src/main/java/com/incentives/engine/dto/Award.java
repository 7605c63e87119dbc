package com.incentives.engine.dto;

import com.incentives.engine.model.Participant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A settlement decision for one participant under one rule, before it becomes a result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Award {
    private Participant participant;
    private int pointsAwarded;
    private String badgeId;
    private String rewardId;
    private String qualificationReason;
    private Double improvementAchieved;
    private Long baselineValue;
}
