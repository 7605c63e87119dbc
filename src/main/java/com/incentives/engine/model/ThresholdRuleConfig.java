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
public class ThresholdRuleConfig extends RuleConfig {
    private long thresholdValue;
    private Integer maxWinners;

    @Override
    @JsonIgnore
    public RuleType getType() {
        return RuleType.THRESHOLD;
    }
}
