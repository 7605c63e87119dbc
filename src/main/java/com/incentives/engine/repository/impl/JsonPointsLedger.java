package com.incentives.engine.repository.impl;

import com.incentives.engine.model.UserPoints;
import com.incentives.engine.repository.PointsLedger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.time.Instant;

@Repository
public class JsonPointsLedger extends JsonDocumentStore<UserPoints> implements PointsLedger {

    private static final String PARTITION = "user-points";

    public JsonPointsLedger(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "user-points").toString(), UserPoints.class);
    }

    @Override
    protected String partitionOf(UserPoints points) {
        return PARTITION;
    }

    @Override
    protected String idOf(UserPoints points) {
        return points.getUserId();
    }

    @Override
    public void incrementPoints(String userId, long amount) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("UserId cannot be null or empty");
        }
        // Upsert: the read and the write share the partition lock
        withPartitionLock(PARTITION, () -> {
            long current = get(PARTITION, userId).map(UserPoints::getTotalPoints).orElse(0L);
            return put(UserPoints.builder()
                .userId(userId)
                .totalPoints(current + amount)
                .updatedAt(Instant.now())
                .build());
        });
    }

    @Override
    public long getPoints(String userId) {
        return get(PARTITION, userId).map(UserPoints::getTotalPoints).orElse(0L);
    }
}
