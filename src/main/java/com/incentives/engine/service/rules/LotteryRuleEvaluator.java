package com.incentives.engine.service.rules;

import com.incentives.engine.dto.Award;
import com.incentives.engine.dto.RuleEvaluation;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.LotteryRuleConfig;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.repository.RuleRepository;
import com.incentives.engine.service.DeterministicSampler;
import com.incentives.engine.service.NotificationFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Lottery rules: participants enter the pool while the competition runs, winners are
 * drawn once at close from a seed stored on the rule, so a draw can be replayed.
 */
@Component
public class LotteryRuleEvaluator implements RuleTypeEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(LotteryRuleEvaluator.class);

    private final NotificationFactory notificationFactory;
    private final DeterministicSampler sampler;
    private final RuleRepository ruleRepository;

    @Autowired
    public LotteryRuleEvaluator(NotificationFactory notificationFactory,
                                DeterministicSampler sampler,
                                RuleRepository ruleRepository) {
        this.notificationFactory = notificationFactory;
        this.sampler = sampler;
        this.ruleRepository = ruleRepository;
    }

    @Override
    public RuleType type() {
        return RuleType.LOTTERY;
    }

    @Override
    public RuleEvaluation evaluate(Competition competition, Rule rule, Participant participant,
                                   long oldValue, long newValue) {
        LotteryRuleConfig config = rule.configAs(LotteryRuleConfig.class);
        long threshold = config.getQualifierThreshold();
        if (newValue < threshold || oldValue >= threshold) {
            return RuleEvaluation.none();
        }

        participant.setLotteryQualifier(true);
        return RuleEvaluation.qualified(
            notificationFactory.lotteryQualified(competition, participant, threshold, newValue,
                config.getWinnerCount()),
            null);
    }

    public static List<Participant> pool(LotteryRuleConfig config, List<Participant> ranking) {
        return ranking.stream()
            .filter(p -> p.getCurrentValue() >= config.getQualifierThreshold())
            .toList();
    }

    @Override
    public List<Award> settle(Competition competition, Rule rule, List<Participant> ranking) {
        LotteryRuleConfig config = rule.configAs(LotteryRuleConfig.class);
        List<Participant> pool = pool(config, ranking);
        if (pool.isEmpty()) {
            logger.info("Lottery rule {} in competition {} has no qualifiers, nothing drawn",
                rule.getId(), competition.getId());
            return List.of();
        }

        String seed = config.getSeed() != null ? config.getSeed() : UUID.randomUUID().toString();
        int winnerCount = Math.min(Math.max(config.getWinnerCount(), 0), pool.size());
        List<Participant> winners = sampler.sample(seed, pool, winnerCount);

        ruleRepository.save(rule.toBuilder()
            .config(LotteryRuleConfig.builder()
                .qualifierThreshold(config.getQualifierThreshold())
                .winnerCount(config.getWinnerCount())
                .seed(seed)
                .drawnAt(Instant.now())
                .build())
            .build());
        logger.info("Drew {} lottery winners from {} qualifiers for rule {} in competition {}",
            winners.size(), pool.size(), rule.getId(), competition.getId());

        String reason = "Lottery Winner (from " + pool.size() + " qualifiers)";
        return winners.stream()
            .map(p -> Award.builder()
                .participant(p)
                .pointsAwarded(rule.getPointsAward())
                .badgeId(rule.getBadgeId())
                .rewardId(rule.getRewardId())
                .qualificationReason(reason)
                .build())
            .toList();
    }
}
