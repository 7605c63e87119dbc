package com.incentives.engine.repository.impl;

import com.incentives.engine.model.Badge;
import com.incentives.engine.repository.BadgeCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Optional;

@Repository
public class JsonBadgeCatalog extends JsonDocumentStore<Badge> implements BadgeCatalog {

    private static final String PARTITION = "badges";

    public JsonBadgeCatalog(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "badges").toString(), Badge.class);
    }

    @Override
    protected String partitionOf(Badge badge) {
        return PARTITION;
    }

    @Override
    protected String idOf(Badge badge) {
        return badge.getId();
    }

    public Badge save(Badge badge) {
        if (badge == null || badge.getId() == null) {
            throw new IllegalArgumentException("Badge id is required");
        }
        return put(badge);
    }

    @Override
    public Optional<Badge> getBadge(String badgeId) {
        return get(PARTITION, badgeId);
    }
}
