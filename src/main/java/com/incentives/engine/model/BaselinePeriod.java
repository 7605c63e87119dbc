package com.incentives.engine.model;

import java.time.Duration;

public enum BaselinePeriod {
    LAST_WEEK(Duration.ofDays(7)),
    LAST_MONTH(Duration.ofDays(30)),
    LAST_QUARTER(Duration.ofDays(90));

    private final Duration length;

    BaselinePeriod(Duration length) {
        this.length = length;
    }

    public Duration length() {
        return length;
    }
}
