package com.incentives.engine.repository;

/**
 * Cumulative points counter per user, owned outside the engine.
 */
public interface PointsLedger {
    void incrementPoints(String userId, long amount);
    long getPoints(String userId);
}
