package com.incentives.engine.repository;

import com.incentives.engine.model.SeasonStanding;

import java.util.Collection;
import java.util.List;

public interface SeasonStandingRepository {
    /** Upserts by (season, user). */
    void saveAll(String seasonId, Collection<SeasonStanding> standings);

    /** Highest total points first. */
    List<SeasonStanding> findBySeasonId(String seasonId);
}
