package com.incentives.engine.service.rules;

import com.incentives.engine.dto.Award;
import com.incentives.engine.dto.RuleEvaluation;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.model.ThresholdRuleConfig;
import com.incentives.engine.service.NotificationFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Stream;

@Component
public class ThresholdRuleEvaluator implements RuleTypeEvaluator {

    static final double APPROACHING_RATIO = 0.9;

    private final NotificationFactory notificationFactory;

    @Autowired
    public ThresholdRuleEvaluator(NotificationFactory notificationFactory) {
        this.notificationFactory = notificationFactory;
    }

    @Override
    public RuleType type() {
        return RuleType.THRESHOLD;
    }

    @Override
    public RuleEvaluation evaluate(Competition competition, Rule rule, Participant participant,
                                   long oldValue, long newValue) {
        long threshold = rule.configAs(ThresholdRuleConfig.class).getThresholdValue();

        if (newValue >= threshold && oldValue < threshold) {
            return RuleEvaluation.qualified(
                notificationFactory.thresholdReached(competition, participant, threshold, newValue,
                    rule.getPointsAward()),
                null);
        }

        double approaching = threshold * APPROACHING_RATIO;
        if (newValue >= approaching && oldValue < approaching && newValue < threshold) {
            return RuleEvaluation.notifyOnly(
                notificationFactory.thresholdApproaching(competition, participant, threshold, newValue));
        }
        return RuleEvaluation.none();
    }

    @Override
    public List<Award> settle(Competition competition, Rule rule, List<Participant> ranking) {
        ThresholdRuleConfig config = rule.configAs(ThresholdRuleConfig.class);
        long threshold = config.getThresholdValue();

        Stream<Participant> qualifiers = ranking.stream()
            .filter(p -> p.getCurrentValue() >= threshold);
        if (config.getMaxWinners() != null && config.getMaxWinners() > 0) {
            qualifiers = qualifiers.limit(config.getMaxWinners());
        }

        return qualifiers
            .map(p -> Award.builder()
                .participant(p)
                .pointsAwarded(rule.getPointsAward())
                .badgeId(rule.getBadgeId())
                .rewardId(rule.getRewardId())
                .qualificationReason("Threshold: " + p.getCurrentValue() + " >= " + threshold)
                .build())
            .toList();
    }
}
