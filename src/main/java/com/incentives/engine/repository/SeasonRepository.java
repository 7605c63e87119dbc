package com.incentives.engine.repository;

import com.incentives.engine.model.Season;

import java.util.Optional;

public interface SeasonRepository {
    Season save(Season season);
    Optional<Season> findById(String seasonId);
}
