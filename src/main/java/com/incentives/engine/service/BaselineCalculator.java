package com.incentives.engine.service;

import com.incentives.engine.config.CompetitionLocks;
import com.incentives.engine.exception.CompetitionNotFoundException;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.BaselinePeriod;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.MetricEvent;
import com.incentives.engine.model.Participant;
import com.incentives.engine.repository.CompetitionRepository;
import com.incentives.engine.repository.MetricEventRepository;
import com.incentives.engine.repository.ParticipantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Sets each participant's improvement baseline to the sum of their metric events over a
 * trailing period.
 */
@Service
public class BaselineCalculator {

    private static final Logger logger = LoggerFactory.getLogger(BaselineCalculator.class);

    private final CompetitionRepository competitionRepository;
    private final ParticipantRepository participantRepository;
    private final MetricEventRepository metricEventRepository;
    private final CompetitionLocks competitionLocks;

    @Autowired
    public BaselineCalculator(
            CompetitionRepository competitionRepository,
            ParticipantRepository participantRepository,
            MetricEventRepository metricEventRepository,
            CompetitionLocks competitionLocks) {
        this.competitionRepository = competitionRepository;
        this.participantRepository = participantRepository;
        this.metricEventRepository = metricEventRepository;
        this.competitionLocks = competitionLocks;
    }

    /**
     * @return the number of participants whose baseline was set
     */
    public int calculateBaselines(String competitionId, BaselinePeriod period) {
        if (period == null) {
            throw new InvalidRequestException("Baseline period cannot be null");
        }
        Competition competition = competitionRepository.findById(competitionId)
            .orElseThrow(() -> new CompetitionNotFoundException(competitionId));

        Instant now = Instant.now();
        Instant since = now.minus(period.length());

        int updated = competitionLocks.withLock(competitionId, () -> {
            List<Participant> participants = participantRepository.findByCompetitionId(competitionId);
            List<Participant> changed = new ArrayList<>(participants.size());
            for (Participant participant : participants) {
                long baseline = metricEventRepository
                    .findByUserIdAndMetricIdSince(participant.getUserId(), competition.getMetricId(), since)
                    .stream()
                    .mapToLong(MetricEvent::getValue)
                    .sum();
                participant.setBaselineValue(baseline);
                participant.setBaselinePeriod(period);
                participant.setBaselineCalculatedAt(now);
                changed.add(participant);
            }
            participantRepository.saveAll(competitionId, changed);
            return changed.size();
        });

        logger.info("Calculated {} baselines for {} participants of competition {}",
            period.name().toLowerCase(Locale.ROOT), updated, competitionId);
        return updated;
    }
}
