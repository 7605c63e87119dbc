package com.incentives.engine.service;

import com.incentives.engine.config.IncentivesProperties;
import com.incentives.engine.exception.IncentivesException;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.RankedParticipant;
import com.incentives.engine.model.RetryQueueItem;
import com.incentives.engine.repository.ParticipantRepository;
import com.incentives.engine.repository.RedisRepository;
import com.incentives.engine.repository.RetryQueueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LiveLeaderboardTest {

    @Mock
    private RedisRepository redisRepository;

    @Mock
    private RetryQueueRepository retryQueueRepository;

    @Mock
    private ParticipantRepository participantRepository;

    private IncentivesProperties properties;
    private LiveLeaderboard liveLeaderboard;

    private final String competitionId = "comp-456";
    private final String userId = "user-789";
    private Participant participant;

    @BeforeEach
    void setUp() {
        properties = new IncentivesProperties();
        liveLeaderboard = new LiveLeaderboard(redisRepository, retryQueueRepository, participantRepository, properties);
        participant = Participant.builder()
            .competitionId(competitionId)
            .userId(userId)
            .currentValue(42)
            .valueReachedAt(Instant.now())
            .build();
    }

    @Test
    void testPublish_WritesValueAndReachTime() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(true);

        // Act
        liveLeaderboard.publish(participant);

        // Assert
        verify(redisRepository).updateValue(competitionId, userId, 42L, participant.getValueReachedAt());
        verify(retryQueueRepository, never()).enqueue(any());
    }

    @Test
    void testPublish_RedisUnavailableQueuesRetry() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(false);

        // Act
        liveLeaderboard.publish(participant);

        // Assert
        ArgumentCaptor<RetryQueueItem> captor = ArgumentCaptor.forClass(RetryQueueItem.class);
        verify(retryQueueRepository).enqueue(captor.capture());
        assertEquals(competitionId, captor.getValue().getCompetitionId());
        assertEquals(42L, captor.getValue().getValue());
        assertEquals(0, captor.getValue().getRetryCount());
        verify(redisRepository, never()).updateValue(anyString(), anyString(), anyLong(), any());
    }

    @Test
    void testPublish_RedisWriteFailureQueuesRetry() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(true);
        doThrow(new IncentivesException("Failed to update value in Redis", "REDIS_WRITE_FAILED"))
            .when(redisRepository).updateValue(anyString(), anyString(), anyLong(), any());

        // Act & Assert
        assertDoesNotThrow(() -> liveLeaderboard.publish(participant));
        verify(retryQueueRepository).enqueue(any(RetryQueueItem.class));
    }

    @Test
    void testGetTopN_FromRedis() {
        // Arrange
        int limit = 10;
        when(redisRepository.isAvailable()).thenReturn(true);
        List<RankedParticipant> ranked = new ArrayList<>();
        for (int i = 0; i < limit; i++) {
            ranked.add(RankedParticipant.builder().userId("user-" + i).rank(i + 1).value(100 - i).build());
        }
        when(redisRepository.getTopN(competitionId, 0, limit)).thenReturn(ranked);

        // Act
        List<RankedParticipant> result = liveLeaderboard.getTopN(competitionId, 0, limit);

        // Assert
        assertEquals(limit, result.size());
        verify(participantRepository, never()).findByCompetitionId(anyString());
    }

    @Test
    void testGetTopN_ColdRedisFallsBackToStorage() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(true);
        when(redisRepository.getTopN(competitionId, 0, 2)).thenReturn(List.of());
        when(participantRepository.findByCompetitionId(competitionId)).thenReturn(List.of(
            Participant.builder().competitionId(competitionId).userId("b").currentValue(5).build(),
            Participant.builder().competitionId(competitionId).userId("a").currentValue(9).build(),
            Participant.builder().competitionId(competitionId).userId("c").currentValue(1).build()));

        // Act
        List<RankedParticipant> result = liveLeaderboard.getTopN(competitionId, 0, 2);

        // Assert
        assertEquals(2, result.size());
        assertEquals("a", result.get(0).getUserId());
        assertEquals(1, result.get(0).getRank());
        assertEquals("b", result.get(1).getUserId());
    }

    @Test
    void testGetTopN_RedisErrorFallsBackToStorage() {
        when(redisRepository.isAvailable()).thenReturn(true);
        when(redisRepository.getTopN(competitionId, 0, 5)).thenThrow(new IncentivesException("boom", "REDIS_READ_FAILED"));
        when(participantRepository.findByCompetitionId(competitionId)).thenReturn(List.of(participant));

        List<RankedParticipant> result = liveLeaderboard.getTopN(competitionId, 0, 5);

        assertEquals(1, result.size());
        assertEquals(42L, result.get(0).getValue());
    }

    @Test
    void testGetTotalParticipants_FallsBackWhenRedisEmpty() {
        when(redisRepository.isAvailable()).thenReturn(true);
        when(redisRepository.getTotalParticipants(competitionId)).thenReturn(0L);
        when(participantRepository.findByCompetitionId(competitionId)).thenReturn(List.of(participant));

        assertEquals(1L, liveLeaderboard.getTotalParticipants(competitionId));
    }

    @Test
    void testProcessRetryQueue_ReplaysAndRemoves() {
        // Arrange
        RetryQueueItem item = RetryQueueItem.builder()
            .competitionId(competitionId).userId(userId).value(42L).retryCount(0).build();
        when(redisRepository.isAvailable()).thenReturn(true);
        when(retryQueueRepository.dequeue(properties.getLiveLeaderboard().getBatchSize())).thenReturn(List.of(item));

        // Act
        liveLeaderboard.processRetryQueue();

        // Assert
        verify(redisRepository).updateValue(eq(competitionId), eq(userId), eq(42L), any());
        verify(retryQueueRepository).remove(item);
        verify(retryQueueRepository, never()).enqueue(any());
    }

    @Test
    void testProcessRetryQueue_StaleItemAfterNewerPublishIsDropped() {
        // Arrange
        Instant earlier = Instant.parse("2026-03-01T09:00:00Z");
        RetryQueueItem stale = RetryQueueItem.builder()
            .competitionId(competitionId).userId(userId).value(5L).valueReachedAt(earlier).retryCount(0).build();
        Participant newer = Participant.builder()
            .competitionId(competitionId).userId(userId).currentValue(6).valueReachedAt(earlier.plusSeconds(5)).build();
        when(redisRepository.isAvailable()).thenReturn(true);
        doReturn(true).when(redisRepository).updateValue(competitionId, userId, 6L, newer.getValueReachedAt());
        doReturn(false).when(redisRepository).updateValue(competitionId, userId, 5L, earlier);
        when(retryQueueRepository.dequeue(anyInt())).thenReturn(List.of(stale));

        // Act
        liveLeaderboard.publish(newer);
        liveLeaderboard.processRetryQueue();

        // Assert
        verify(redisRepository).updateValue(competitionId, userId, 5L, earlier);
        verify(retryQueueRepository).remove(stale);
        verify(retryQueueRepository, never()).enqueue(any());
        assertEquals(0, stale.getRetryCount());
    }

    @Test
    void testProcessRetryQueue_FailureRequeuesUntilMaxRetries() {
        // Arrange
        properties.getLiveLeaderboard().setMaxRetries(3);
        RetryQueueItem retryable = RetryQueueItem.builder()
            .competitionId(competitionId).userId("u1").value(1L).retryCount(0).build();
        RetryQueueItem exhausted = RetryQueueItem.builder()
            .competitionId(competitionId).userId("u2").value(2L).retryCount(2).build();
        when(redisRepository.isAvailable()).thenReturn(true);
        when(retryQueueRepository.dequeue(anyInt())).thenReturn(List.of(retryable, exhausted));
        doThrow(new IncentivesException("Redis is not available", "REDIS_UNAVAILABLE"))
            .when(redisRepository).updateValue(anyString(), anyString(), anyLong(), any());

        // Act
        liveLeaderboard.processRetryQueue();

        // Assert
        verify(retryQueueRepository).enqueue(retryable);
        verify(retryQueueRepository, never()).enqueue(exhausted);
        assertEquals(1, retryable.getRetryCount());
        assertEquals(3, exhausted.getRetryCount());
    }

    @Test
    void testProcessRetryQueue_SkippedWhileRedisDown() {
        when(redisRepository.isAvailable()).thenReturn(false);

        liveLeaderboard.processRetryQueue();

        verify(retryQueueRepository, never()).dequeue(anyInt());
    }
}
