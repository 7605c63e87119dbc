package com.incentives.engine.service;

import com.incentives.engine.config.IncentivesProperties;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionStatus;
import com.incentives.engine.repository.CompetitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Reports competitions stuck in evaluating. A failed settlement is never resumed
 * automatically; an operator inspects the partial results first.
 */
@Component
public class EvaluatingCompetitionMonitor {

    private static final Logger logger = LoggerFactory.getLogger(EvaluatingCompetitionMonitor.class);

    private final CompetitionRepository competitionRepository;
    private final IncentivesProperties properties;

    @Autowired
    public EvaluatingCompetitionMonitor(CompetitionRepository competitionRepository, IncentivesProperties properties) {
        this.competitionRepository = competitionRepository;
        this.properties = properties;
    }

    @Scheduled(fixedDelay = 60000)
    public void reportStuckCompetitions() {
        try {
            findStuck(Instant.now()).forEach(competition ->
                logger.error("Competition {} ({}) has been evaluating since {}, settlement needs operator action",
                    competition.getId(), competition.getName(), competition.getEvaluationStartedAt()));
        } catch (Exception e) {
            logger.error("Error scanning for stuck competitions", e);
        }
    }

    public List<Competition> findStuck(Instant now) {
        Instant cutoff = now.minus(properties.getSettlement().getStuckAfter());
        return competitionRepository.findByStatus(CompetitionStatus.EVALUATING).stream()
            .filter(c -> c.getEvaluationStartedAt() == null || c.getEvaluationStartedAt().isBefore(cutoff))
            .toList();
    }
}
