package com.incentives.engine.repository;

import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface CompetitionRepository {
    Competition save(Competition competition);
    Optional<Competition> findById(String competitionId);
    List<Competition> findActiveByMetricId(String metricId);
    List<Competition> findByStatus(CompetitionStatus status);
    List<Competition> findBySeasonIdAndStatus(String seasonId, CompetitionStatus status);

    /**
     * Applies {@code transition} only if the stored status still equals {@code expected}.
     * Returns the updated competition, or empty when the competition is missing or the
     * status no longer matches.
     */
    Optional<Competition> compareAndSetStatus(String competitionId, CompetitionStatus expected,
                                              UnaryOperator<Competition> transition);
}
