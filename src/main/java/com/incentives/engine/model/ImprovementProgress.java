package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImprovementProgress implements NotificationData {
    private long baselineValue;
    private long currentValue;
    private double improvementPercent;
    private double requiredPercent;
    private Integer pointsEarned;
}
