package com.incentives.engine.model;

import java.util.Locale;

public enum CompetitionStatus {
    DRAFT,
    ACTIVE,
    EVALUATING,
    COMPLETED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
