package com.incentives.engine.repository;

import com.incentives.engine.model.GameEvent;

import java.util.Optional;

public interface GameEventRepository {
    GameEvent save(GameEvent event);
    Optional<GameEvent> findById(String userId, String eventId);
}
