package com.incentives.engine.service;

import com.incentives.engine.dto.GameEventResult;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.GameEvent;
import com.incentives.engine.model.GameEventType;
import com.incentives.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameEventBusTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        fixture.metric("metric-doors", "doors");
        fixture.metric("metric-contracts", "contracts");
        fixture.activeCompetition("comp-doors", "metric-doors");
        fixture.activeCompetition("comp-contracts", "metric-contracts");
        fixture.enroll("comp-doors", "user-1", 0);
        fixture.enroll("comp-contracts", "user-1", 0);
    }

    @Test
    void testEmit_FansOutToEveryMappedMetric() {
        // Arrange
        GameEvent event = GameEvent.builder().type(GameEventType.HARVEST_SIGNED).userId("user-1").build();

        // Act
        GameEventResult result = fixture.gameEventBus.emit(event);

        // Assert
        assertNotNull(result.getEventId());
        assertEquals(10, result.getPoints());
        assertEquals(List.of("doors", "contracts"), result.getMetricSlugs());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(10, fixture.participantRepository.findByCompetitionIdAndUserId("comp-doors", "user-1")
            .get().getCurrentValue());
        assertEquals(1, fixture.participantRepository.findByCompetitionIdAndUserId("comp-contracts", "user-1")
            .get().getCurrentValue());

        GameEvent stored = fixture.gameEventRepository.findById("user-1", result.getEventId()).get();
        assertTrue(stored.isProcessed());
        assertNotNull(stored.getProcessedAt());
    }

    @Test
    void testEmit_DispositionPointsOverrideDefault() {
        GameEvent event = GameEvent.builder()
            .type(GameEventType.HARVEST_VISIT)
            .userId("user-1")
            .dispositionPoints(4)
            .build();

        GameEventResult result = fixture.gameEventBus.emit(event);

        assertEquals(4, result.getPoints());
        assertEquals(4, fixture.participantRepository.findByCompetitionIdAndUserId("comp-doors", "user-1")
            .get().getCurrentValue());
    }

    @Test
    void testEmit_UnmappedTypeIsStoredOnly() {
        GameEventResult result = fixture.gameEventBus.emit(
            GameEvent.builder().type(GameEventType.CLAIMS_ASSIGNED).userId("user-1").build());

        assertTrue(result.getMetricSlugs().isEmpty());
        assertTrue(fixture.gameEventRepository.findById("user-1", result.getEventId()).get().isProcessed());
    }

    @Test
    void testEmit_InvalidEvents() {
        assertThrows(InvalidRequestException.class, () -> fixture.gameEventBus.emit(null));
        assertThrows(InvalidRequestException.class,
            () -> fixture.gameEventBus.emit(GameEvent.builder().userId("user-1").build()));
        assertThrows(InvalidRequestException.class,
            () -> fixture.gameEventBus.emit(GameEvent.builder().type(GameEventType.HARVEST_VISIT).build()));
        assertThrows(InvalidRequestException.class, () -> fixture.gameEventBus.emit(GameEvent.builder()
            .type(GameEventType.HARVEST_VISIT).userId("user-1").dispositionPoints(-1).build()));
    }

    @Test
    void testFromCode_ParsesWireCodes() {
        assertEquals(GameEventType.CLAIMS_SETTLED, GameEventType.fromCode("claims.settled"));
        assertThrows(IllegalArgumentException.class, () -> GameEventType.fromCode("claims.unknown"));
    }
}
