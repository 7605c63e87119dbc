package com.incentives.engine.repository.impl;

import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionStatus;
import com.incentives.engine.repository.CompetitionRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Repository
public class JsonCompetitionRepository extends JsonDocumentStore<Competition> implements CompetitionRepository {

    private static final String PARTITION = "competitions";

    public JsonCompetitionRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "competitions").toString(), Competition.class);
    }

    @Override
    protected String partitionOf(Competition competition) {
        return PARTITION;
    }

    @Override
    protected String idOf(Competition competition) {
        return competition.getId();
    }

    @Override
    public Competition save(Competition competition) {
        if (competition == null || competition.getId() == null) {
            throw new IllegalArgumentException("Competition id is required");
        }
        if (competition.getStatus() == null) {
            throw new IllegalArgumentException("Competition status is required");
        }
        return put(competition);
    }

    @Override
    public Optional<Competition> findById(String competitionId) {
        return get(PARTITION, competitionId);
    }

    @Override
    public List<Competition> findActiveByMetricId(String metricId) {
        return list(PARTITION).stream()
            .filter(c -> c.getStatus() == CompetitionStatus.ACTIVE)
            .filter(c -> Objects.equals(metricId, c.getMetricId()))
            .toList();
    }

    @Override
    public List<Competition> findByStatus(CompetitionStatus status) {
        return list(PARTITION).stream()
            .filter(c -> c.getStatus() == status)
            .toList();
    }

    @Override
    public List<Competition> findBySeasonIdAndStatus(String seasonId, CompetitionStatus status) {
        return list(PARTITION).stream()
            .filter(c -> Objects.equals(seasonId, c.getSeasonId()))
            .filter(c -> c.getStatus() == status)
            .toList();
    }

    @Override
    public Optional<Competition> compareAndSetStatus(String competitionId, CompetitionStatus expected,
                                                     UnaryOperator<Competition> transition) {
        if (competitionId == null) {
            return Optional.empty();
        }
        return computeIf(PARTITION, competitionId, c -> c.getStatus() == expected, transition);
    }
}
