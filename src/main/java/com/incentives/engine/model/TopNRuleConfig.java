package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class TopNRuleConfig extends RuleConfig {
    @Builder.Default
    private int topN = 3;

    @Builder.Default
    private List<RewardTier> rewardTiers = new ArrayList<>();

    public Optional<RewardTier> tierForRank(int rank) {
        if (rewardTiers == null) {
            return Optional.empty();
        }
        return rewardTiers.stream()
            .filter(tier -> tier.getRank() == rank)
            .findFirst();
    }

    @Override
    @JsonIgnore
    public RuleType getType() {
        return RuleType.TOP_N;
    }
}
