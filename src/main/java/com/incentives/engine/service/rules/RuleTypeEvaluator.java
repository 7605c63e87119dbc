package com.incentives.engine.service.rules;

import com.incentives.engine.dto.Award;
import com.incentives.engine.dto.RuleEvaluation;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;

import java.util.List;

/**
 * Evaluation logic for one rule type, both while a competition runs and when it closes.
 */
public interface RuleTypeEvaluator {

    RuleType type();

    /**
     * Checks whether the update from {@code oldValue} to {@code newValue} crossed a
     * boundary of the rule. May mutate rule-specific state on {@code participant}
     * (milestone tier, improvement, lottery entry); never writes results.
     */
    RuleEvaluation evaluate(Competition competition, Rule rule, Participant participant,
                            long oldValue, long newValue);

    /**
     * Decides the winners of the rule over the final ranking, which is already in
     * authoritative rank order.
     */
    List<Award> settle(Competition competition, Rule rule, List<Participant> ranking);

    /**
     * Whether the rule keeps being evaluated after the participant first qualified for it.
     */
    default boolean reevaluatesAfterQualifying() {
        return false;
    }
}
