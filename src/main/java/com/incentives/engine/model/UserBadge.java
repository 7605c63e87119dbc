package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserBadge {
    private String id;
    private String userId;
    private String badgeId;
    private String badgeName;
    private String badgeIcon;
    private String badgeTier;
    private String competitionId;
    private String earnedReason;
    private Instant earnedAt;
}
