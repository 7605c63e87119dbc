package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class LotteryRuleConfig extends RuleConfig {
    private long qualifierThreshold;

    @Builder.Default
    private int winnerCount = 1;

    // Persisted on first draw so the draw can be replayed
    private String seed;
    private Instant drawnAt;

    @Override
    @JsonIgnore
    public RuleType getType() {
        return RuleType.LOTTERY;
    }
}
