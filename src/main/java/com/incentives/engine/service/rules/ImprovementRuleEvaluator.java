package com.incentives.engine.service.rules;

import com.incentives.engine.dto.Award;
import com.incentives.engine.dto.RuleEvaluation;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.ImprovementRuleConfig;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.service.NotificationFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Improvement over a per-participant baseline. Participants without a positive baseline
 * are never evaluated.
 */
@Component
public class ImprovementRuleEvaluator implements RuleTypeEvaluator {

    static final double APPROACHING_RATIO = 0.8;

    private final NotificationFactory notificationFactory;

    @Autowired
    public ImprovementRuleEvaluator(NotificationFactory notificationFactory) {
        this.notificationFactory = notificationFactory;
    }

    @Override
    public RuleType type() {
        return RuleType.IMPROVEMENT;
    }

    @Override
    public RuleEvaluation evaluate(Competition competition, Rule rule, Participant participant,
                                   long oldValue, long newValue) {
        Long baseline = participant.getBaselineValue();
        if (baseline == null || baseline <= 0) {
            return RuleEvaluation.none();
        }

        double required = rule.configAs(ImprovementRuleConfig.class).getImprovementPercent();
        double current = improvement(newValue, baseline);
        double previous = improvement(oldValue, baseline);

        if (current >= required && previous < required) {
            participant.setImprovementPercent(current);
            return RuleEvaluation.qualified(
                notificationFactory.improvementAchieved(competition, participant, baseline, newValue,
                    current, required, rule.getPointsAward()),
                null);
        }

        double approaching = required * APPROACHING_RATIO;
        if (current >= approaching && previous < approaching && current < required) {
            return RuleEvaluation.notifyOnly(
                notificationFactory.improvementApproaching(competition, participant, baseline, newValue,
                    current, required));
        }
        return RuleEvaluation.none();
    }

    @Override
    public List<Award> settle(Competition competition, Rule rule, List<Participant> ranking) {
        double required = rule.configAs(ImprovementRuleConfig.class).getImprovementPercent();

        List<Award> awards = new ArrayList<>();
        for (Participant participant : ranking) {
            Long baseline = participant.getBaselineValue();
            if (baseline == null || baseline <= 0) {
                continue;
            }
            double achieved = improvement(participant.getCurrentValue(), baseline);
            if (achieved < required) {
                continue;
            }
            awards.add(Award.builder()
                .participant(participant)
                .pointsAwarded(rule.getPointsAward())
                .badgeId(rule.getBadgeId())
                .rewardId(rule.getRewardId())
                .improvementAchieved(achieved)
                .baselineValue(baseline)
                .qualificationReason(String.format(Locale.ROOT, "Improvement: %.1f%% (beat %s%% target)",
                    achieved, NotificationFactory.formatPercent(required)))
                .build());
        }
        return awards;
    }

    static double improvement(long value, long baseline) {
        return (value - baseline) / (double) baseline * 100.0;
    }
}
