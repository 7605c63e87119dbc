package com.incentives.engine.service.rules;

import com.incentives.engine.dto.Award;
import com.incentives.engine.dto.RuleEvaluation;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.MilestoneRuleConfig;
import com.incentives.engine.model.MilestoneTier;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.service.NotificationFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Component
public class MilestoneRuleEvaluator implements RuleTypeEvaluator {

    private final NotificationFactory notificationFactory;

    @Autowired
    public MilestoneRuleEvaluator(NotificationFactory notificationFactory) {
        this.notificationFactory = notificationFactory;
    }

    @Override
    public RuleType type() {
        return RuleType.MILESTONE;
    }

    // Tiers are progressive: reaching bronze must not stop silver from firing later
    @Override
    public boolean reevaluatesAfterQualifying() {
        return true;
    }

    @Override
    public RuleEvaluation evaluate(Competition competition, Rule rule, Participant participant,
                                   long oldValue, long newValue) {
        MilestoneRuleConfig config = rule.configAs(MilestoneRuleConfig.class);

        Optional<MilestoneTier> highest = highestReached(config, newValue);
        if (highest.isEmpty()) {
            return RuleEvaluation.none();
        }

        MilestoneTier tier = highest.get();
        int reachedIndex = config.indexOf(tier.getTier());
        int currentIndex = config.indexOf(participant.getMilestoneReached());
        if (reachedIndex <= currentIndex) {
            return RuleEvaluation.none();
        }

        participant.setMilestoneReached(tier.getTier());
        return RuleEvaluation.qualified(
            notificationFactory.milestoneReached(competition, participant, tier),
            tier.getTier());
    }

    static Optional<MilestoneTier> highestReached(MilestoneRuleConfig config, long value) {
        if (config.getMilestones() == null) {
            return Optional.empty();
        }
        return config.getMilestones().stream()
            .sorted(Comparator.comparingLong(MilestoneTier::getValue).reversed())
            .filter(tier -> value >= tier.getValue())
            .findFirst();
    }

    @Override
    public List<Award> settle(Competition competition, Rule rule, List<Participant> ranking) {
        MilestoneRuleConfig config = rule.configAs(MilestoneRuleConfig.class);

        List<Award> awards = new ArrayList<>();
        for (Participant participant : ranking) {
            if (participant.getMilestoneReached() == null) {
                continue;
            }
            config.findTier(participant.getMilestoneReached()).ifPresent(tier -> awards.add(Award.builder()
                .participant(participant)
                .pointsAwarded(tier.getPointsAward())
                .badgeId(tier.getBadgeId())
                .rewardId(tier.getRewardId())
                .qualificationReason("Milestone: " + NotificationFactory.capitalize(tier.getTier()) + " Tier")
                .build()));
        }
        return awards;
    }
}
