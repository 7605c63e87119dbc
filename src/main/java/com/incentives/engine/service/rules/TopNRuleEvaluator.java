package com.incentives.engine.service.rules;

import com.incentives.engine.dto.Award;
import com.incentives.engine.dto.RuleEvaluation;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.RewardTier;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.model.TopNRuleConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Top-N rules only pay out at close; a running rank is not a qualification.
 */
@Component
public class TopNRuleEvaluator implements RuleTypeEvaluator {

    @Override
    public RuleType type() {
        return RuleType.TOP_N;
    }

    @Override
    public RuleEvaluation evaluate(Competition competition, Rule rule, Participant participant,
                                   long oldValue, long newValue) {
        return RuleEvaluation.none();
    }

    @Override
    public List<Award> settle(Competition competition, Rule rule, List<Participant> ranking) {
        TopNRuleConfig config = rule.configAs(TopNRuleConfig.class);
        int topN = Math.max(0, Math.min(config.getTopN(), ranking.size()));

        List<Award> awards = new ArrayList<>(topN);
        for (int i = 0; i < topN; i++) {
            int rank = i + 1;
            Optional<RewardTier> tier = config.tierForRank(rank);
            awards.add(Award.builder()
                .participant(ranking.get(i))
                .pointsAwarded(tier.map(RewardTier::getBonusPoints).orElse(rule.getPointsAward()))
                .rewardId(tier.map(RewardTier::getRewardId).orElse(rule.getRewardId()))
                .badgeId(rule.getBadgeId())
                .qualificationReason("Top " + config.getTopN() + " - Rank #" + rank)
                .build());
        }
        return awards;
    }
}
