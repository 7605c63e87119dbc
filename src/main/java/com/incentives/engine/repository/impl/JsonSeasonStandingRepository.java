package com.incentives.engine.repository.impl;

import com.incentives.engine.model.SeasonStanding;
import com.incentives.engine.repository.SeasonStandingRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Repository
public class JsonSeasonStandingRepository extends JsonDocumentStore<SeasonStanding>
        implements SeasonStandingRepository {

    public JsonSeasonStandingRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "season-standings").toString(), SeasonStanding.class);
    }

    @Override
    protected String partitionOf(SeasonStanding standing) {
        return standing.getSeasonId();
    }

    @Override
    protected String idOf(SeasonStanding standing) {
        return standing.getUserId();
    }

    @Override
    public void saveAll(String seasonId, Collection<SeasonStanding> standings) {
        putAll(seasonId, standings);
    }

    @Override
    public List<SeasonStanding> findBySeasonId(String seasonId) {
        return list(seasonId).stream()
            .sorted(Comparator.comparingInt(SeasonStanding::getTotalPoints).reversed()
                .thenComparing(Comparator.comparingInt(SeasonStanding::getCompetitionsWon).reversed())
                .thenComparing(SeasonStanding::getUserId))
            .toList();
    }
}
