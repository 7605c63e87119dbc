package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum NotificationType {
    THRESHOLD_REACHED("threshold_reached"),
    THRESHOLD_APPROACHING("threshold_approaching"),
    MILESTONE_REACHED("milestone_reached"),
    RANK_IMPROVED("rank_improved"),
    IMPROVEMENT_ACHIEVED("improvement_achieved"),
    IMPROVEMENT_APPROACHING("improvement_approaching"),
    LOTTERY_QUALIFIED("lottery_qualified"),
    COMPETITION_RESULT("competition_result"),
    COMPETITION_ENDED("competition_ended"),
    BADGE_EARNED("badge_earned");

    private final String code;

    NotificationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static NotificationType fromCode(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown notification type: " + code));
    }
}
