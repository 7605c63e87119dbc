package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class ImprovementRuleConfig extends RuleConfig {
    @Builder.Default
    private double improvementPercent = 10.0;

    @Builder.Default
    private BaselinePeriod baselinePeriod = BaselinePeriod.LAST_WEEK;

    @Override
    @JsonIgnore
    public RuleType getType() {
        return RuleType.IMPROVEMENT;
    }
}
