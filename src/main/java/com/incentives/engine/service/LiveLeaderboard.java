package com.incentives.engine.service;

import com.incentives.engine.config.IncentivesProperties;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.RankedParticipant;
import com.incentives.engine.model.RetryQueueItem;
import com.incentives.engine.repository.ParticipantRepository;
import com.incentives.engine.repository.RedisRepository;
import com.incentives.engine.repository.RetryQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis mirror of competition standings. The participant store stays authoritative:
 * writes here are best effort and queued for retry when Redis is unavailable, and
 * reads fall back to the store.
 */
@Service
public class LiveLeaderboard {

    private static final Logger logger = LoggerFactory.getLogger(LiveLeaderboard.class);

    private final RedisRepository redisRepository;
    private final RetryQueueRepository retryQueueRepository;
    private final ParticipantRepository participantRepository;
    private final IncentivesProperties properties;

    @Autowired
    public LiveLeaderboard(
            RedisRepository redisRepository,
            RetryQueueRepository retryQueueRepository,
            ParticipantRepository participantRepository,
            IncentivesProperties properties) {
        this.redisRepository = redisRepository;
        this.retryQueueRepository = retryQueueRepository;
        this.participantRepository = participantRepository;
        this.properties = properties;
    }

    /**
     * Mirror a participant's current value. Never throws; failures end up in the retry queue.
     */
    public void publish(Participant participant) {
        String competitionId = participant.getCompetitionId();
        String userId = participant.getUserId();

        if (!redisRepository.isAvailable()) {
            logger.warn("Redis is not available, queueing live leaderboard update for retry");
            queueUpdate(participant);
            return;
        }

        try {
            boolean applied = redisRepository.updateValue(competitionId, userId,
                participant.getCurrentValue(), participant.getValueReachedAt());
            if (applied) {
                logger.debug("Updated live leaderboard for user {} in competition {}", userId, competitionId);
            } else {
                logger.debug("Live leaderboard already ahead for user {} in competition {}", userId, competitionId);
            }
        } catch (Exception e) {
            logger.error("Failed to update live leaderboard, queueing for retry", e);
            queueUpdate(participant);
        }
    }

    private void queueUpdate(Participant participant) {
        try {
            retryQueueRepository.enqueue(RetryQueueItem.builder()
                .competitionId(participant.getCompetitionId())
                .userId(participant.getUserId())
                .value(participant.getCurrentValue())
                .valueReachedAt(participant.getValueReachedAt())
                .createdAt(Instant.now())
                .retryCount(0)
                .build());
            logger.info("Queued live leaderboard update for retry: competitionId={}, userId={}",
                participant.getCompetitionId(), participant.getUserId());
        } catch (Exception e) {
            logger.error("Failed to queue live leaderboard update for competition {} user {}",
                participant.getCompetitionId(), participant.getUserId(), e);
        }
    }

    /**
     * Ranked slice of a competition. Reads from Redis if it is available and warm,
     * otherwise ranks the participant store.
     */
    public List<RankedParticipant> getTopN(String competitionId, int offset, int limit) {
        List<RankedParticipant> fromRedis = tryGetTopNFromRedis(competitionId, offset, limit);
        if (fromRedis != null && !fromRedis.isEmpty()) {
            return fromRedis;
        }
        return getTopNFromStorage(competitionId, offset, limit);
    }

    private List<RankedParticipant> tryGetTopNFromRedis(String competitionId, int offset, int limit) {
        if (!redisRepository.isAvailable()) {
            return null;
        }
        try {
            List<RankedParticipant> topN = redisRepository.getTopN(competitionId, offset, limit);
            logger.debug("Retrieved {} participants from Redis for competition {}", topN.size(), competitionId);
            return topN;
        } catch (Exception e) {
            logger.warn("Failed to retrieve from Redis, falling back to persistent storage", e);
            return null;
        }
    }

    private List<RankedParticipant> getTopNFromStorage(String competitionId, int offset, int limit) {
        List<Participant> ranked = participantRepository.findByCompetitionId(competitionId).stream()
            .sorted(RankEngine.RANKING_ORDER)
            .toList();

        List<RankedParticipant> page = new ArrayList<>();
        for (int i = offset; i < ranked.size() && page.size() < limit; i++) {
            Participant participant = ranked.get(i);
            page.add(RankedParticipant.builder()
                .userId(participant.getUserId())
                .rank(i + 1)
                .value(participant.getCurrentValue())
                .valueReachedAt(participant.getValueReachedAt())
                .build());
        }
        return page;
    }

    public long getTotalParticipants(String competitionId) {
        if (redisRepository.isAvailable()) {
            try {
                Long total = redisRepository.getTotalParticipants(competitionId);
                if (total != null && total > 0) {
                    return total;
                }
            } catch (Exception e) {
                logger.warn("Failed to get participant count from Redis, falling back to storage", e);
            }
        }
        return participantRepository.findByCompetitionId(competitionId).size();
    }

    /**
     * Replays queued writes. Called periodically by {@link RetryQueueProcessor}.
     */
    public void processRetryQueue() {
        if (!redisRepository.isAvailable()) {
            logger.debug("Redis is not available, skipping retry queue processing");
            return;
        }

        List<RetryQueueItem> items = retryQueueRepository.dequeue(properties.getLiveLeaderboard().getBatchSize());
        if (items.isEmpty()) {
            return;
        }

        logger.info("Processing {} items from retry queue", items.size());
        items.forEach(this::processRetryQueueItem);
    }

    private void processRetryQueueItem(RetryQueueItem item) {
        try {
            boolean applied = redisRepository.updateValue(item.getCompetitionId(), item.getUserId(),
                item.getValue() == null ? 0L : item.getValue(), item.getValueReachedAt());
            retryQueueRepository.remove(item);
            if (applied) {
                logger.info("Successfully retried live leaderboard update: competitionId={}, userId={}",
                    item.getCompetitionId(), item.getUserId());
            } else {
                logger.info("Dropped stale live leaderboard update: competitionId={}, userId={}, value={}",
                    item.getCompetitionId(), item.getUserId(), item.getValue());
            }
        } catch (Exception e) {
            handleRetryFailure(item, e);
        }
    }

    private void handleRetryFailure(RetryQueueItem item, Exception e) {
        logger.warn("Failed to retry live leaderboard update, will retry later: competitionId={}, userId={}",
            item.getCompetitionId(), item.getUserId(), e);

        int retryCount = item.getRetryCount() == null ? 1 : item.getRetryCount() + 1;
        item.setRetryCount(retryCount);
        if (retryCount < properties.getLiveLeaderboard().getMaxRetries()) {
            retryQueueRepository.enqueue(item);
        } else {
            logger.error("Max retry count exceeded for item: competitionId={}, userId={}",
                item.getCompetitionId(), item.getUserId());
        }
    }
}
