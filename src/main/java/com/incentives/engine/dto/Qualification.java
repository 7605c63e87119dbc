package com.incentives.engine.dto;

import com.incentives.engine.model.RuleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Qualification {
    private String competitionId;
    private String userId;
    private String ruleId;
    private RuleType ruleType;
    // Milestone tier for milestone rules
    private String detail;
}
