package com.incentives.engine.repository.impl;

import com.incentives.engine.model.CompetitionResult;
import com.incentives.engine.repository.ResultRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Repository
public class JsonResultRepository extends JsonDocumentStore<CompetitionResult> implements ResultRepository {

    public JsonResultRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "results").toString(), CompetitionResult.class);
    }

    @Override
    protected String partitionOf(CompetitionResult result) {
        return result.getCompetitionId();
    }

    @Override
    protected String idOf(CompetitionResult result) {
        return result.getId();
    }

    @Override
    public void saveAll(String competitionId, Collection<CompetitionResult> results) {
        putAll(competitionId, results);
    }

    @Override
    public List<CompetitionResult> findByCompetitionId(String competitionId) {
        return list(competitionId).stream()
            .sorted(Comparator.comparingInt(CompetitionResult::getFinalRank))
            .toList();
    }
}
