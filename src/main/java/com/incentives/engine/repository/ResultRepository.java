package com.incentives.engine.repository;

import com.incentives.engine.model.CompetitionResult;

import java.util.Collection;
import java.util.List;

public interface ResultRepository {
    void saveAll(String competitionId, Collection<CompetitionResult> results);
    List<CompetitionResult> findByCompetitionId(String competitionId);
}
