package com.incentives.engine.repository.impl;

import com.incentives.engine.model.BaselinePeriod;
import com.incentives.engine.model.Participant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonParticipantRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testSave_SurvivesReload() {
        // Arrange
        JsonParticipantRepository repository = new JsonParticipantRepository(tempDir.toString());
        Participant participant = Participant.builder()
            .competitionId("comp-1")
            .userId("user-1")
            .userName("Dana")
            .currentValue(42)
            .baselineValue(30L)
            .baselinePeriod(BaselinePeriod.LAST_MONTH)
            .valueReachedAt(Instant.parse("2026-03-01T09:00:00Z"))
            .build();
        participant.getQualifiedRules().add("rule-1");
        repository.save(participant);

        // Act
        JsonParticipantRepository reloaded = new JsonParticipantRepository(tempDir.toString());
        Optional<Participant> found = reloaded.findByCompetitionIdAndUserId("comp-1", "user-1");

        // Assert
        assertTrue(found.isPresent());
        assertEquals(42, found.get().getCurrentValue());
        assertEquals(BaselinePeriod.LAST_MONTH, found.get().getBaselinePeriod());
        assertTrue(found.get().hasQualifiedFor("rule-1"));
        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), found.get().getValueReachedAt());
        assertTrue(Files.exists(tempDir.resolve("participants").resolve("comp-1.json")));
    }

    @Test
    void testFind_ReturnsCopies() {
        // Arrange
        JsonParticipantRepository repository = new JsonParticipantRepository(tempDir.toString());
        repository.save(Participant.builder().competitionId("comp-1").userId("user-1").currentValue(5).build());

        // Act
        Participant copy = repository.findByCompetitionIdAndUserId("comp-1", "user-1").get();
        copy.setCurrentValue(500);
        copy.getQualifiedRules().add("rule-x");

        // Assert
        Participant stored = repository.findByCompetitionIdAndUserId("comp-1", "user-1").get();
        assertEquals(5, stored.getCurrentValue());
        assertFalse(stored.hasQualifiedFor("rule-x"));
    }

    @Test
    void testUpdate_MissingParticipant() {
        JsonParticipantRepository repository = new JsonParticipantRepository(tempDir.toString());

        Optional<Participant> result = repository.update("comp-1", "ghost", p -> {
            p.setCurrentValue(1);
            return p;
        });

        assertTrue(result.isEmpty());
        assertTrue(repository.findByCompetitionId("comp-1").isEmpty());
    }

    @Test
    void testSaveAll_PartitionsAreIsolated() {
        // Arrange
        JsonParticipantRepository repository = new JsonParticipantRepository(tempDir.toString());
        repository.saveAll("comp-1", List.of(
            Participant.builder().competitionId("comp-1").userId("a").build(),
            Participant.builder().competitionId("comp-1").userId("b").build()));
        repository.save(Participant.builder().competitionId("comp-2").userId("a").build());

        // Act & Assert
        assertEquals(2, repository.findByCompetitionId("comp-1").size());
        assertEquals(1, repository.findByCompetitionId("comp-2").size());
        assertThrows(IllegalArgumentException.class, () -> repository.saveAll("comp-1",
            List.of(Participant.builder().competitionId("comp-2").userId("c").build())));
    }

    @Test
    void testSave_RequiresKeys() {
        JsonParticipantRepository repository = new JsonParticipantRepository(tempDir.toString());

        assertThrows(IllegalArgumentException.class,
            () -> repository.save(Participant.builder().userId("user-1").build()));
        assertThrows(IllegalArgumentException.class,
            () -> repository.save(Participant.builder().competitionId("comp-1").build()));
    }
}
