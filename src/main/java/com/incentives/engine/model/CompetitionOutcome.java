package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetitionOutcome implements NotificationData {
    private String competitionId;
    private String competitionName;
    private Integer finalRank;
    private long finalValue;
    private Integer pointsAwarded;
    private String qualificationReason;
}
