package com.incentives.engine.config;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per competition. Event pipelines and settlement of the same competition
 * serialize on it; different competitions never contend. An entry lives only while
 * some thread holds or waits for it.
 */
@Component
public class CompetitionLocks {

    private final Map<String, CountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String competitionId, Supplier<T> action) {
        if (competitionId == null || competitionId.trim().isEmpty()) {
            throw new IllegalArgumentException("CompetitionId cannot be null or empty");
        }
        CountedLock entry = locks.compute(competitionId, (id, existing) -> {
            CountedLock counted = existing != null ? existing : new CountedLock();
            counted.holders++;
            return counted;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(competitionId, (id, counted) -> --counted.holders == 0 ? null : counted);
        }
    }

    public boolean isHeldByCurrentThread(String competitionId) {
        CountedLock entry = locks.get(competitionId);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    int trackedCompetitions() {
        return locks.size();
    }

    // holders is only touched inside ConcurrentHashMap.compute for the same key
    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
