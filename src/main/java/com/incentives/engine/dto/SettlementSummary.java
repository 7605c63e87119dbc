package com.incentives.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementSummary {
    private String competitionId;
    private String competitionName;
    private int resultsCount;
    private int badgesAwarded;
    private int notificationsSent;
}
