package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdProgress implements NotificationData {
    private long threshold;
    private long currentValue;
    private Long gap;
    private Integer pointsEarned;
}
