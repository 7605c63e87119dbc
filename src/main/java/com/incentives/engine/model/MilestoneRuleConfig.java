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
public class MilestoneRuleConfig extends RuleConfig {
    @Builder.Default
    private List<MilestoneTier> milestones = new ArrayList<>();

    /**
     * Position of the tier in the configured list, or -1 when the tier is null or unknown.
     */
    public int indexOf(String tier) {
        if (tier == null || milestones == null) {
            return -1;
        }
        for (int i = 0; i < milestones.size(); i++) {
            if (tier.equals(milestones.get(i).getTier())) {
                return i;
            }
        }
        return -1;
    }

    public Optional<MilestoneTier> findTier(String tier) {
        int index = indexOf(tier);
        return index < 0 ? Optional.empty() : Optional.of(milestones.get(index));
    }

    @Override
    @JsonIgnore
    public RuleType getType() {
        return RuleType.MILESTONE;
    }
}
