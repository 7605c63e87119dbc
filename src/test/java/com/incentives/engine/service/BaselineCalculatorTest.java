package com.incentives.engine.service;

import com.incentives.engine.exception.CompetitionNotFoundException;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.BaselinePeriod;
import com.incentives.engine.model.MetricEvent;
import com.incentives.engine.model.Participant;
import com.incentives.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BaselineCalculatorTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        fixture.metric("metric-doors", "doors");
        fixture.metric("metric-calls", "calls");
        fixture.activeCompetition("comp-1", "metric-doors");
    }

    private void event(String userId, String metricId, long value, Instant createdAt) {
        fixture.metricEventRepository.save(MetricEvent.builder()
            .id(UUID.randomUUID().toString())
            .userId(userId)
            .metricId(metricId)
            .value(value)
            .eventType("manual")
            .createdAt(createdAt)
            .build());
    }

    @Test
    void testCalculateBaselines_SumsEventsInsideThePeriod() {
        // Arrange
        Instant now = Instant.now();
        fixture.enroll("comp-1", "user-1", 0);
        fixture.enroll("comp-1", "user-2", 0);
        event("user-1", "metric-doors", 30, now.minus(Duration.ofDays(2)));
        event("user-1", "metric-doors", 12, now.minus(Duration.ofDays(6)));
        event("user-1", "metric-doors", 99, now.minus(Duration.ofDays(10)));
        event("user-1", "metric-calls", 7, now.minus(Duration.ofDays(1)));

        // Act
        int updated = fixture.baselineCalculator.calculateBaselines("comp-1", BaselinePeriod.LAST_WEEK);

        // Assert
        assertEquals(2, updated);
        Participant first = fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "user-1").get();
        assertEquals(42L, first.getBaselineValue());
        assertEquals(BaselinePeriod.LAST_WEEK, first.getBaselinePeriod());
        assertNotNull(first.getBaselineCalculatedAt());
        Participant second = fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "user-2").get();
        assertEquals(0L, second.getBaselineValue());
    }

    @Test
    void testCalculateBaselines_LongerPeriodReachesFurtherBack() {
        Instant now = Instant.now();
        fixture.enroll("comp-1", "user-1", 0);
        event("user-1", "metric-doors", 30, now.minus(Duration.ofDays(2)));
        event("user-1", "metric-doors", 99, now.minus(Duration.ofDays(10)));

        fixture.baselineCalculator.calculateBaselines("comp-1", BaselinePeriod.LAST_MONTH);

        assertEquals(129L, fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "user-1")
            .get().getBaselineValue());
    }

    @Test
    void testCalculateBaselines_InvalidArguments() {
        assertThrows(InvalidRequestException.class, () -> fixture.baselineCalculator.calculateBaselines("comp-1", null));
        assertThrows(CompetitionNotFoundException.class,
            () -> fixture.baselineCalculator.calculateBaselines("missing", BaselinePeriod.LAST_WEEK));
    }
}
