package com.incentives.engine.model;

public enum RuleType {
    THRESHOLD("threshold"),
    TOP_N("top_n"),
    MILESTONE("milestone"),
    IMPROVEMENT("improvement"),
    LOTTERY("lottery");

    private final String label;

    RuleType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
