package com.incentives.engine.repository.impl;

import com.incentives.engine.model.LotteryRuleConfig;
import com.incentives.engine.model.MilestoneRuleConfig;
import com.incentives.engine.model.MilestoneTier;
import com.incentives.engine.model.RewardTier;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.RuleType;
import com.incentives.engine.model.TopNRuleConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRuleRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testFindByCompetitionId_PriorityOrderWithTypedConfigs() {
        // Arrange
        JsonRuleRepository repository = new JsonRuleRepository(tempDir.toString());
        repository.save(Rule.builder().id("rule-lottery").competitionId("comp-1").priority(3)
            .config(LotteryRuleConfig.builder().qualifierThreshold(10).winnerCount(2).seed("abc").build())
            .build());
        repository.save(Rule.builder().id("rule-top").competitionId("comp-1").priority(1)
            .config(TopNRuleConfig.builder().topN(3)
                .rewardTiers(List.of(RewardTier.builder().rank(1).rewardId("tv").bonusPoints(500).build()))
                .build())
            .build());
        repository.save(Rule.builder().id("rule-milestone").competitionId("comp-1").priority(2)
            .config(MilestoneRuleConfig.builder()
                .milestones(List.of(MilestoneTier.builder().tier("bronze").value(25).build()))
                .build())
            .build());

        // Act
        List<Rule> rules = new JsonRuleRepository(tempDir.toString()).findByCompetitionId("comp-1");

        // Assert
        assertEquals(List.of("rule-top", "rule-milestone", "rule-lottery"), rules.stream().map(Rule::getId).toList());
        assertEquals(RuleType.TOP_N, rules.get(0).getType());
        assertEquals("tv", rules.get(0).configAs(TopNRuleConfig.class).tierForRank(1).get().getRewardId());
        assertEquals("abc", rules.get(2).configAs(LotteryRuleConfig.class).getSeed());
        assertThrows(IllegalStateException.class, () -> rules.get(1).configAs(TopNRuleConfig.class));
    }
}
