package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BadgeAward implements NotificationData {
    private String badgeId;
    private String badgeName;
    private String badgeIcon;
    private String badgeTier;
    private String competitionId;
    private String earnedReason;
}
