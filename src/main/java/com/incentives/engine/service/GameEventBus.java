package com.incentives.engine.service;

import com.incentives.engine.dto.EventRecordResult;
import com.incentives.engine.dto.GameEventResult;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.GameEvent;
import com.incentives.engine.model.GameEventType;
import com.incentives.engine.repository.GameEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Turns module activity (doors knocked, claims settled, contracts signed) into metric
 * events. One game event can feed several metrics.
 */
@Service
public class GameEventBus {

    private static final Logger logger = LoggerFactory.getLogger(GameEventBus.class);

    private final GameEventRepository gameEventRepository;
    private final EventRecorder eventRecorder;

    @Autowired
    public GameEventBus(GameEventRepository gameEventRepository, EventRecorder eventRecorder) {
        this.gameEventRepository = gameEventRepository;
        this.eventRecorder = eventRecorder;
    }

    public GameEventResult emit(GameEvent event) {
        validateGameEvent(event);
        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        }
        if (event.getTs() == null) {
            event.setTs(Instant.now());
        }
        event.setProcessed(false);
        gameEventRepository.save(event);

        GameEventType type = event.getType();
        int points = event.getDispositionPoints() != null ? event.getDispositionPoints() : type.defaultPoints();

        GameEventResult result = GameEventResult.builder()
            .eventId(event.getId())
            .type(type)
            .points(points)
            .build();

        for (String slug : type.metricSlugs()) {
            long value = GameEventType.POINTS_METRIC.equals(slug) ? points : 1;
            try {
                EventRecordResult recorded = eventRecorder.record(event.getUserId(), slug, value,
                    type.code(), event.getId());
                result.getMetricSlugs().add(slug);
                result.getRecorded().add(recorded);
            } catch (RuntimeException e) {
                logger.error("Failed to record metric {} for game event {} ({})", slug, event.getId(), type.code(), e);
                result.getErrors().put(slug, e.getMessage());
            }
        }

        event.setProcessed(true);
        event.setProcessedAt(Instant.now());
        gameEventRepository.save(event);

        logger.info("Processed game event {} ({}) for user {}: {} metrics recorded, {} failed",
            event.getId(), type.code(), event.getUserId(), result.getRecorded().size(), result.getErrors().size());
        return result;
    }

    private void validateGameEvent(GameEvent event) {
        if (event == null) {
            throw new InvalidRequestException("GameEvent cannot be null");
        }
        if (event.getType() == null) {
            throw new InvalidRequestException("GameEvent type cannot be null");
        }
        if (event.getUserId() == null || event.getUserId().trim().isEmpty()) {
            throw new InvalidRequestException("UserId cannot be null or empty");
        }
        if (event.getDispositionPoints() != null && event.getDispositionPoints() < 0) {
            throw new InvalidRequestException("Disposition points cannot be negative");
        }
    }
}
