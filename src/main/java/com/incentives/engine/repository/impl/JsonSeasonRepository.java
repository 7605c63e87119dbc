package com.incentives.engine.repository.impl;

import com.incentives.engine.model.Season;
import com.incentives.engine.repository.SeasonRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Optional;

@Repository
public class JsonSeasonRepository extends JsonDocumentStore<Season> implements SeasonRepository {

    private static final String PARTITION = "seasons";

    public JsonSeasonRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "seasons").toString(), Season.class);
    }

    @Override
    protected String partitionOf(Season season) {
        return PARTITION;
    }

    @Override
    protected String idOf(Season season) {
        return season.getId();
    }

    @Override
    public Season save(Season season) {
        if (season == null || season.getId() == null) {
            throw new IllegalArgumentException("Season id is required");
        }
        return put(season);
    }

    @Override
    public Optional<Season> findById(String seasonId) {
        return get(PARTITION, seasonId);
    }
}
