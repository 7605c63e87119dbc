package com.incentives.engine.service;

import com.incentives.engine.dto.LotteryPool;
import com.incentives.engine.exception.CompetitionNotFoundException;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.LotteryRuleConfig;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.repository.CompetitionRepository;
import com.incentives.engine.repository.RuleRepository;
import com.incentives.engine.service.rules.LotteryRuleEvaluator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class LotteryService {

    private final CompetitionRepository competitionRepository;
    private final RuleRepository ruleRepository;
    private final RankEngine rankEngine;

    @Autowired
    public LotteryService(CompetitionRepository competitionRepository,
                          RuleRepository ruleRepository,
                          RankEngine rankEngine) {
        this.competitionRepository = competitionRepository;
        this.ruleRepository = ruleRepository;
        this.rankEngine = rankEngine;
    }

    /**
     * Current lottery pool of the competition's first lottery rule, in ranking order.
     * Nothing is drawn.
     */
    public LotteryPool getLotteryQualifiers(String competitionId) {
        Competition competition = competitionRepository.findById(competitionId)
            .orElseThrow(() -> new CompetitionNotFoundException(competitionId));

        Rule rule = ruleRepository.findByCompetitionId(competitionId).stream()
            .filter(r -> r.getType() == RuleType.LOTTERY)
            .findFirst()
            .orElseThrow(() -> new InvalidRequestException(
                "Competition " + competitionId + " has no lottery rule"));

        return LotteryPool.builder()
            .competition(competition)
            .rule(rule)
            .qualifiers(LotteryRuleEvaluator.pool(rule.configAs(LotteryRuleConfig.class),
                rankEngine.ranking(competitionId)))
            .build();
    }
}
