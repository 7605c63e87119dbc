package com.incentives.engine.service;

import com.incentives.engine.dto.RankRecomputation;
import com.incentives.engine.model.Participant;
import com.incentives.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankEngineTest {

    @TempDir
    Path tempDir;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        fixture.metric("metric-doors", "doors");
        fixture.activeCompetition("comp-1", "metric-doors");
    }

    @Test
    void testRanking_HigherValueFirstThenEarlierReachThenUserId() {
        // Arrange
        Instant earlier = Instant.parse("2026-03-01T10:00:00Z");
        Instant later = Instant.parse("2026-03-01T11:00:00Z");
        fixture.enroll("comp-1", "carol", 10, later);
        fixture.enroll("comp-1", "bob", 10, earlier);
        fixture.enroll("comp-1", "dave", 8);
        fixture.enroll("comp-1", "alice", 8);
        fixture.enroll("comp-1", "erin", 12, later);

        // Act
        List<Participant> ranking = fixture.rankEngine.ranking("comp-1");

        // Assert
        assertEquals(List.of("erin", "bob", "carol", "alice", "dave"),
            ranking.stream().map(Participant::getUserId).toList());
    }

    @Test
    void testRanking_UnknownReachTimeSortsAfterKnown() {
        fixture.enroll("comp-1", "aaron", 10);
        fixture.enroll("comp-1", "zoe", 10, Instant.parse("2026-03-01T10:00:00Z"));

        List<Participant> ranking = fixture.rankEngine.ranking("comp-1");

        assertEquals("zoe", ranking.get(0).getUserId());
    }

    @Test
    void testRecompute_AssignsDenseRanksAndPercentiles() {
        // Arrange
        fixture.enroll("comp-1", "a", 30);
        fixture.enroll("comp-1", "b", 20);
        fixture.enroll("comp-1", "c", 10);
        fixture.enroll("comp-1", "d", 0);

        // Act
        RankRecomputation recomputation = fixture.rankEngine.recompute("comp-1", "c");

        // Assert
        assertEquals(4, recomputation.getUpdatedCount());
        assertEquals(3, recomputation.getFocusUserRank());
        assertNull(recomputation.getFocusPreviousRank());

        List<Participant> stored = fixture.rankEngine.ranking("comp-1");
        for (int i = 0; i < stored.size(); i++) {
            assertEquals(i + 1, stored.get(i).getRank());
        }
        assertEquals(100.0, stored.get(0).getPercentile(), 0.0001);
        assertEquals(25.0, stored.get(3).getPercentile(), 0.0001);
    }

    @Test
    void testRecompute_OnlyWritesChangedRows() {
        // Arrange
        fixture.enroll("comp-1", "a", 30);
        fixture.enroll("comp-1", "b", 20);
        fixture.enroll("comp-1", "c", 10);
        fixture.rankEngine.recompute("comp-1", null);

        Participant climber = fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "c").get();
        climber.setCurrentValue(25);
        fixture.participantRepository.save(climber);

        // Act
        RankRecomputation recomputation = fixture.rankEngine.recompute("comp-1", "c");

        // Assert
        assertEquals(2, recomputation.getUpdatedCount());
        assertEquals(2, recomputation.getFocusUserRank());
        assertEquals(3, recomputation.getFocusPreviousRank());
        assertTrue(recomputation.focusImproved());

        Participant passed = fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "b").get();
        assertEquals(3, passed.getRank());
        assertEquals(2, passed.getPreviousRank());
        Participant leader = fixture.participantRepository.findByCompetitionIdAndUserId("comp-1", "a").get();
        assertEquals(1, leader.getRank());
        assertNull(leader.getPreviousRank());
    }

    @Test
    void testRecompute_EmptyCompetition() {
        RankRecomputation recomputation = fixture.rankEngine.recompute("comp-1", "nobody");

        assertEquals(0, recomputation.getUpdatedCount());
        assertNull(recomputation.getFocusUserRank());
    }
}
