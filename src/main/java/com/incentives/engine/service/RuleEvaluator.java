package com.incentives.engine.service;

import com.incentives.engine.dto.IncrementalEvaluation;
import com.incentives.engine.dto.Qualification;
import com.incentives.engine.dto.RuleEvaluation;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.service.rules.RuleTypeEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes each rule to the evaluator for its type and collects what the rules produced.
 */
@Service
public class RuleEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(RuleEvaluator.class);

    private final Map<RuleType, RuleTypeEvaluator> evaluators = new EnumMap<>(RuleType.class);

    @Autowired
    public RuleEvaluator(List<RuleTypeEvaluator> evaluators) {
        for (RuleTypeEvaluator evaluator : evaluators) {
            RuleTypeEvaluator previous = this.evaluators.put(evaluator.type(), evaluator);
            if (previous != null) {
                throw new IllegalStateException("Two evaluators registered for rule type " + evaluator.type().label()
                    + ": " + previous.getClass().getSimpleName() + " and " + evaluator.getClass().getSimpleName());
            }
        }
    }

    public RuleTypeEvaluator evaluatorFor(RuleType type) {
        RuleTypeEvaluator evaluator = type == null ? null : evaluators.get(type);
        if (evaluator == null) {
            throw new IllegalStateException("No evaluator for rule type " + type);
        }
        return evaluator;
    }

    /**
     * Evaluates the rules in priority order against one participant update. The
     * participant is mutated in place: qualified rule ids are added and rule-specific
     * state is set. The caller persists it.
     */
    public IncrementalEvaluation evaluate(Competition competition, List<Rule> rules, Participant participant,
                                          long oldValue, long newValue) {
        IncrementalEvaluation evaluation = IncrementalEvaluation.builder().build();

        for (Rule rule : rules) {
            if (rule.getType() == null) {
                logger.warn("Rule {} in competition {} has no type, skipping", rule.getId(), competition.getId());
                continue;
            }

            RuleTypeEvaluator evaluator = evaluatorFor(rule.getType());
            if (participant.hasQualifiedFor(rule.getId()) && !evaluator.reevaluatesAfterQualifying()) {
                continue;
            }

            RuleEvaluation outcome = evaluator.evaluate(competition, rule, participant, oldValue, newValue);
            evaluation.getNotifications().addAll(outcome.getNotifications());

            if (outcome.isQualified()) {
                participant.getQualifiedRules().add(rule.getId());
                evaluation.getQualifications().add(Qualification.builder()
                    .competitionId(competition.getId())
                    .userId(participant.getUserId())
                    .ruleId(rule.getId())
                    .ruleType(rule.getType())
                    .detail(outcome.getDetail())
                    .build());
                logger.info("User {} qualified for {} rule {} in competition {}",
                    participant.getUserId(), rule.getType().label(), rule.getId(), competition.getId());
            }
        }
        return evaluation;
    }
}
