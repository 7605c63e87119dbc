package com.incentives.engine.repository.impl;

import com.incentives.engine.model.GameEvent;
import com.incentives.engine.repository.GameEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Optional;

@Repository
public class JsonGameEventRepository extends JsonDocumentStore<GameEvent> implements GameEventRepository {

    public JsonGameEventRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "game-events").toString(), GameEvent.class);
    }

    @Override
    protected String partitionOf(GameEvent event) {
        return event.getUserId();
    }

    @Override
    protected String idOf(GameEvent event) {
        return event.getId();
    }

    @Override
    public GameEvent save(GameEvent event) {
        if (event == null || event.getId() == null || event.getUserId() == null) {
            throw new IllegalArgumentException("GameEvent id and userId are required");
        }
        return put(event);
    }

    @Override
    public Optional<GameEvent> findById(String userId, String eventId) {
        return get(userId, eventId);
    }
}
