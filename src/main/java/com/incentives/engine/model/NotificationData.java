package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed payload carried by a {@link Notification}; one subtype per notification family.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ThresholdProgress.class, name = "threshold"),
    @JsonSubTypes.Type(value = MilestoneProgress.class, name = "milestone"),
    @JsonSubTypes.Type(value = ImprovementProgress.class, name = "improvement"),
    @JsonSubTypes.Type(value = LotteryEntry.class, name = "lottery"),
    @JsonSubTypes.Type(value = RankChange.class, name = "rank"),
    @JsonSubTypes.Type(value = CompetitionOutcome.class, name = "outcome"),
    @JsonSubTypes.Type(value = BadgeAward.class, name = "badge")
})
public interface NotificationData {
}
