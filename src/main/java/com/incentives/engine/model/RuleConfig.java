package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Type-specific part of a {@link Rule}. The concrete subtype is the rule's type and
 * is resolved once, when the rule document is read.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ThresholdRuleConfig.class, name = "threshold"),
    @JsonSubTypes.Type(value = TopNRuleConfig.class, name = "top_n"),
    @JsonSubTypes.Type(value = MilestoneRuleConfig.class, name = "milestone"),
    @JsonSubTypes.Type(value = ImprovementRuleConfig.class, name = "improvement"),
    @JsonSubTypes.Type(value = LotteryRuleConfig.class, name = "lottery")
})
public abstract class RuleConfig {

    @JsonIgnore
    public abstract RuleType getType();
}
