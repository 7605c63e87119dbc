package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Rule {
    private String id;
    private String competitionId;

    @Builder.Default
    private int priority = 1;

    private int pointsAward;
    private String badgeId;
    private String rewardId;
    private RuleConfig config;
    private Instant createdAt;

    @JsonIgnore
    public RuleType getType() {
        return config != null ? config.getType() : null;
    }

    /**
     * Narrow the config to the subtype a rule-type evaluator expects.
     */
    public <T extends RuleConfig> T configAs(Class<T> configType) {
        if (!configType.isInstance(config)) {
            throw new IllegalStateException("Rule " + id + " has config "
                + (config == null ? "null" : config.getClass().getSimpleName())
                + ", expected " + configType.getSimpleName());
        }
        return configType.cast(config);
    }
}
