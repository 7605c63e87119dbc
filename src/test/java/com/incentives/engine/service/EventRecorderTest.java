package com.incentives.engine.service;

import com.incentives.engine.dto.EventRecordResult;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.CompetitionStatus;
import com.incentives.engine.model.Notification;
import com.incentives.engine.model.NotificationType;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.ThresholdRuleConfig;
import com.incentives.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class EventRecorderTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        fixture.metric("metric-doors", "doors");
        fixture.activeCompetition("comp-1", "metric-doors");
        fixture.rule("rule-50", "comp-1", 1, 100, ThresholdRuleConfig.builder().thresholdValue(50).build());
    }

    @Test
    void testRecord_UnknownMetricIsIgnored() {
        // Act
        EventRecordResult result = fixture.eventRecorder.record("user-1", "unknown_metric", 5, "manual", null);

        // Assert
        assertFalse(result.isRecorded());
        assertNull(result.getEventId());
        assertTrue(result.getAffectedCompetitions().isEmpty());
    }

    @Test
    void testRecord_InvalidInput() {
        assertThrows(InvalidRequestException.class, () -> fixture.eventRecorder.record(null, "doors", 1, "manual", null));
        assertThrows(InvalidRequestException.class, () -> fixture.eventRecorder.record(" ", "doors", 1, "manual", null));
        assertThrows(InvalidRequestException.class, () -> fixture.eventRecorder.record("user-1", "", 1, "manual", null));
        assertThrows(InvalidRequestException.class, () -> fixture.eventRecorder.record("user-1", "doors", -1, "manual", null));
    }

    @Test
    void testRecord_CrossingThresholdNotifiesOnce() {
        // Arrange
        fixture.enroll("comp-1", "user-1", 40);

        // Act
        EventRecordResult result = fixture.eventRecorder.record("user-1", "doors", 15, "manual", "ref-1");

        // Assert
        assertTrue(result.isRecorded());
        assertEquals(List.of("comp-1"), result.getAffectedCompetitions());
        assertEquals(1, result.getQualifications().size());
        List<Notification> reached = result.getNotifications().stream()
            .filter(n -> n.getType() == NotificationType.THRESHOLD_REACHED)
            .toList();
        assertEquals(1, reached.size());

        Participant stored = fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "user-1").get();
        assertEquals(55, stored.getCurrentValue());
        assertTrue(stored.hasQualifiedFor("rule-50"));
        assertEquals(1, stored.getRank());

        assertEquals(1, fixture.notificationRepository.findByUserId("user-1").stream()
            .filter(n -> n.getType() == NotificationType.THRESHOLD_REACHED)
            .count());
    }

    @Test
    void testRecord_RepeatedCrossingDoesNotNotifyAgain() {
        // Arrange
        fixture.enroll("comp-1", "user-1", 40);
        fixture.eventRecorder.record("user-1", "doors", 15, "manual", "ref-1");

        // Act
        EventRecordResult second = fixture.eventRecorder.record("user-1", "doors", 10, "manual", "ref-2");

        // Assert
        assertTrue(second.getQualifications().isEmpty());
        assertTrue(second.getNotifications().stream()
            .noneMatch(n -> n.getType() == NotificationType.THRESHOLD_REACHED));
        assertEquals(65, fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "user-1")
            .get().getCurrentValue());
    }

    @Test
    void testRecord_RankImprovementIsReportedAndNotified() {
        // Arrange
        fixture.enroll("comp-1", "a", 30, Instant.parse("2026-03-01T09:00:00Z"));
        fixture.enroll("comp-1", "b", 20, Instant.parse("2026-03-01T09:00:00Z"));
        fixture.enroll("comp-1", "c", 5, Instant.parse("2026-03-01T09:00:00Z"));
        fixture.rankEngine.recompute("comp-1", null);

        // Act
        EventRecordResult result = fixture.eventRecorder.record("c", "doors", 30, "manual", null);

        // Assert
        assertEquals(1, result.getRankChanges().size());
        assertEquals(3, result.getRankChanges().get(0).getOldRank());
        assertEquals(1, result.getRankChanges().get(0).getNewRank());
        assertTrue(result.getNotifications().stream()
            .anyMatch(n -> n.getType() == NotificationType.RANK_IMPROVED && "c".equals(n.getUserId())));
    }

    @Test
    void testRecord_NotEnrolledUserTouchesNothing() {
        // Act
        EventRecordResult result = fixture.eventRecorder.record("stranger", "doors", 3, "manual", null);

        // Assert
        assertTrue(result.isRecorded());
        assertNotNull(result.getEventId());
        assertTrue(result.getAffectedCompetitions().isEmpty());
        assertTrue(fixture.participantRepository.findByCompetitionId("comp-1").isEmpty());
    }

    @Test
    void testRecord_SkipsCompetitionsThatAreNotActive() {
        // Arrange
        fixture.competition("comp-done", "metric-doors", null, CompetitionStatus.COMPLETED);
        fixture.enroll("comp-done", "user-1", 10);
        fixture.enroll("comp-1", "user-1", 10);

        // Act
        EventRecordResult result = fixture.eventRecorder.record("user-1", "doors", 5, "manual", null);

        // Assert
        assertEquals(List.of("comp-1"), result.getAffectedCompetitions());
        assertEquals(10, fixture.participantRepository.findByCompetitionIdAndUserId("comp-done", "user-1")
            .get().getCurrentValue());
    }

    @Test
    void testRecord_QueuesLiveUpdateWhenRedisIsDown() {
        fixture.enroll("comp-1", "user-1", 0);

        fixture.eventRecorder.record("user-1", "doors", 1, "manual", null);

        assertEquals(1, fixture.retryQueueRepository.size());
    }

    @Test
    void testRecord_PublishesLiveUpdateWhileHoldingCompetitionLock() {
        // Arrange
        fixture.enroll("comp-1", "user-1", 0);
        AtomicBoolean lockHeld = new AtomicBoolean(false);
        when(fixture.redisRepository.isAvailable()).thenReturn(true);
        doAnswer(invocation -> {
            lockHeld.set(fixture.locks.isHeldByCurrentThread("comp-1"));
            return true;
        }).when(fixture.redisRepository).updateValue(anyString(), anyString(), anyLong(), any());

        // Act
        fixture.eventRecorder.record("user-1", "doors", 7, "manual", null);

        // Assert
        verify(fixture.redisRepository).updateValue(eq("comp-1"), eq("user-1"), eq(7L), any());
        assertTrue(lockHeld.get());
        assertEquals(0, fixture.retryQueueRepository.size());
    }
}
