package com.incentives.engine.repository;

import com.incentives.engine.model.RankedParticipant;

import java.time.Instant;
import java.util.List;

public interface RedisRepository {
    /**
     * Writes the participant's value. Returns false when Redis already holds a higher
     * value for the user, in which case nothing changes.
     */
    boolean updateValue(String competitionId, String userId, long value, Instant valueReachedAt);
    List<RankedParticipant> getTopN(String competitionId, int offset, int limit);
    Long getRankPosition(String competitionId, String userId);
    Long getTotalParticipants(String competitionId);
    boolean isAvailable();
}
