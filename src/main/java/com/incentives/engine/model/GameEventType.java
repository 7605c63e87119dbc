package com.incentives.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Module-level activity types and the metrics each one feeds.
 */
public enum GameEventType {
    HARVEST_VISIT("harvest.visit", 1, List.of("doors")),
    HARVEST_APPOINTMENT("harvest.appointment", 5, List.of("doors", "appointments")),
    HARVEST_SIGNED("harvest.signed", 10, List.of("doors", "contracts")),
    CLAIMS_CREATED("claims.created", 3, List.of("claims_created")),
    CLAIMS_ASSIGNED("claims.assigned", 1, List.of()),
    CLAIMS_STATUS_CHANGED("claims.status_changed", 1, List.of()),
    CLAIMS_SETTLED("claims.settled", 20, List.of("claims_settled")),
    INSPECTION_STARTED("inspection.started", 1, List.of()),
    INSPECTION_COMPLETED("inspection.completed", 5, List.of("inspections_completed")),
    INSPECTION_PHOTO_ADDED("inspection.photo_added", 1, List.of()),
    CONTRACT_CREATED("contract.created", 1, List.of()),
    CONTRACT_SENT("contract.sent", 1, List.of()),
    CONTRACT_SIGNED("contract.signed", 15, List.of("contracts_signed")),
    UNIVERSITY_COURSE_STARTED("university.course_started", 1, List.of()),
    UNIVERSITY_COURSE_COMPLETED("university.course_completed", 10, List.of("courses_completed")),
    UNIVERSITY_ARTICLE_READ("university.article_read", 1, List.of()),
    VOICE_CALL_HANDLED("voice.call_handled", 1, List.of()),
    VOICE_CALL_MATCHED("voice.call_matched", 1, List.of());

    /** The one metric that is credited with points instead of a count of 1. */
    public static final String POINTS_METRIC = "doors";

    private final String code;
    private final int defaultPoints;
    private final List<String> metricSlugs;

    GameEventType(String code, int defaultPoints, List<String> metricSlugs) {
        this.code = code;
        this.defaultPoints = defaultPoints;
        this.metricSlugs = metricSlugs;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int defaultPoints() {
        return defaultPoints;
    }

    public List<String> metricSlugs() {
        return metricSlugs;
    }

    @JsonCreator
    public static GameEventType fromCode(String code) {
        return find(code)
            .orElseThrow(() -> new IllegalArgumentException("Unknown game event type: " + code));
    }

    public static Optional<GameEventType> find(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .findFirst();
    }
}
