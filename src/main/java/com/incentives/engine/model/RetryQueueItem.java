package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A live leaderboard write that could not reach Redis and waits for replay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryQueueItem {
    private String competitionId;
    private String userId;
    private Long value;
    private Instant valueReachedAt;
    private Instant createdAt;
    private Integer retryCount;
}
