package com.incentives.engine.service;

import com.incentives.engine.config.CompetitionLocks;
import com.incentives.engine.dto.EventRecordResult;
import com.incentives.engine.dto.IncrementalEvaluation;
import com.incentives.engine.dto.RankMovement;
import com.incentives.engine.dto.RankRecomputation;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionStatus;
import com.incentives.engine.model.Metric;
import com.incentives.engine.model.MetricEvent;
import com.incentives.engine.model.Notification;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.repository.CompetitionRepository;
import com.incentives.engine.repository.MetricEventRepository;
import com.incentives.engine.repository.NotificationRepository;
import com.incentives.engine.repository.ParticipantRepository;
import com.incentives.engine.repository.RuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for field activity. Stores the raw metric event, then runs the
 * ledger, rank and rule pipeline for every active competition tracking the metric.
 */
@Service
public class EventRecorder {

    private static final Logger logger = LoggerFactory.getLogger(EventRecorder.class);

    private final MetricRegistry metricRegistry;
    private final CompetitionRepository competitionRepository;
    private final MetricEventRepository metricEventRepository;
    private final ParticipantRepository participantRepository;
    private final RuleRepository ruleRepository;
    private final NotificationRepository notificationRepository;
    private final ParticipantLedger participantLedger;
    private final RankEngine rankEngine;
    private final RuleEvaluator ruleEvaluator;
    private final NotificationFactory notificationFactory;
    private final LiveLeaderboard liveLeaderboard;
    private final CompetitionLocks competitionLocks;

    @Autowired
    public EventRecorder(
            MetricRegistry metricRegistry,
            CompetitionRepository competitionRepository,
            MetricEventRepository metricEventRepository,
            ParticipantRepository participantRepository,
            RuleRepository ruleRepository,
            NotificationRepository notificationRepository,
            ParticipantLedger participantLedger,
            RankEngine rankEngine,
            RuleEvaluator ruleEvaluator,
            NotificationFactory notificationFactory,
            LiveLeaderboard liveLeaderboard,
            CompetitionLocks competitionLocks) {
        this.metricRegistry = metricRegistry;
        this.competitionRepository = competitionRepository;
        this.metricEventRepository = metricEventRepository;
        this.participantRepository = participantRepository;
        this.ruleRepository = ruleRepository;
        this.notificationRepository = notificationRepository;
        this.participantLedger = participantLedger;
        this.rankEngine = rankEngine;
        this.ruleEvaluator = ruleEvaluator;
        this.notificationFactory = notificationFactory;
        this.liveLeaderboard = liveLeaderboard;
        this.competitionLocks = competitionLocks;
    }

    public EventRecordResult record(String userId, String metricSlug, long value, String eventType, String sourceRef) {
        validateRecordRequest(userId, metricSlug, value);

        Optional<Metric> metric = metricRegistry.findBySlug(metricSlug);
        if (metric.isEmpty()) {
            logger.warn("Unknown metric slug {}, event for user {} ignored", metricSlug, userId);
            return EventRecordResult.ignored();
        }
        String metricId = metric.get().getId();

        List<Competition> competitions = competitionRepository.findActiveByMetricId(metricId);
        MetricEvent event = metricEventRepository.save(MetricEvent.builder()
            .id(UUID.randomUUID().toString())
            .userId(userId)
            .metricId(metricId)
            .value(value)
            .eventType(eventType)
            .sourceRef(sourceRef)
            .competitionIds(competitions.stream().map(Competition::getId).toList())
            .createdAt(Instant.now())
            .build());

        EventRecordResult result = EventRecordResult.builder()
            .recorded(true)
            .eventId(event.getId())
            .metricId(metricId)
            .build();

        for (Competition competition : competitions) {
            try {
                updateCompetition(competition.getId(), userId, value, result);
            } catch (RuntimeException e) {
                logger.error("Failed to apply event {} to competition {} for user {}",
                    event.getId(), competition.getId(), userId, e);
            }
        }

        logger.info("Recorded {} {} for user {}: {} competitions affected, {} notifications",
            value, metricSlug, userId, result.getAffectedCompetitions().size(), result.getNotifications().size());
        return result;
    }

    private void validateRecordRequest(String userId, String metricSlug, long value) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidRequestException("UserId cannot be null or empty");
        }
        if (metricSlug == null || metricSlug.trim().isEmpty()) {
            throw new InvalidRequestException("Metric slug cannot be null or empty");
        }
        if (value < 0) {
            throw new InvalidRequestException("Value cannot be negative");
        }
    }

    private void updateCompetition(String competitionId, String userId, long delta, EventRecordResult result) {
        competitionLocks.withLock(competitionId, () -> runPipeline(competitionId, userId, delta, result));
    }

    /**
     * Ledger update, rank recompute, rule evaluation and live leaderboard publish for one
     * competition. Runs under the competition lock, so mirror writes follow ledger order.
     * Returns the participant after evaluation, or null when nothing was applied.
     */
    private Participant runPipeline(String competitionId, String userId, long delta, EventRecordResult result) {
        // Settlement may have closed the competition since it was looked up
        Optional<Competition> current = competitionRepository.findById(competitionId)
            .filter(c -> c.getStatus() == CompetitionStatus.ACTIVE);
        if (current.isEmpty()) {
            logger.debug("Competition {} is no longer active, skipping", competitionId);
            return null;
        }
        Competition competition = current.get();

        Optional<Participant> applied = participantLedger.applyDelta(competition, userId, delta);
        if (applied.isEmpty()) {
            return null;
        }
        long oldValue = applied.get().getPreviousValue();
        long newValue = applied.get().getCurrentValue();

        RankRecomputation ranks = rankEngine.recompute(competitionId, userId);
        Participant participant = participantRepository.findByCompetitionIdAndUserId(competitionId, userId)
            .orElseThrow(() -> new IllegalStateException(
                "Participant " + userId + " vanished from competition " + competitionId));

        List<Notification> notifications = new ArrayList<>();
        recordRankMovement(competition, userId, ranks, notifications, result);

        List<Rule> rules = ruleRepository.findByCompetitionId(competitionId);
        IncrementalEvaluation evaluation = ruleEvaluator.evaluate(competition, rules, participant, oldValue, newValue);
        notifications.addAll(evaluation.getNotifications());

        if (evaluation.hasQualifications()) {
            participantRepository.update(competitionId, userId, stored -> {
                stored.getQualifiedRules().addAll(participant.getQualifiedRules());
                stored.setMilestoneReached(participant.getMilestoneReached());
                stored.setImprovementPercent(participant.getImprovementPercent());
                stored.setLotteryQualifier(participant.isLotteryQualifier());
                return stored;
            });
        }
        if (!notifications.isEmpty()) {
            notificationRepository.saveAll(notifications);
        }

        result.getAffectedCompetitions().add(competitionId);
        result.getNotifications().addAll(notifications);
        result.getQualifications().addAll(evaluation.getQualifications());

        liveLeaderboard.publish(participant);
        return participant;
    }

    private void recordRankMovement(Competition competition, String userId, RankRecomputation ranks,
                                    List<Notification> notifications, EventRecordResult result) {
        Integer oldRank = ranks.getFocusPreviousRank();
        Integer newRank = ranks.getFocusUserRank();
        if (oldRank == null || newRank == null || oldRank.equals(newRank)) {
            return;
        }

        result.getRankChanges().add(RankMovement.builder()
            .competitionId(competition.getId())
            .userId(userId)
            .oldRank(oldRank)
            .newRank(newRank)
            .build());

        if (ranks.focusImproved()) {
            notifications.add(notificationFactory.rankImproved(competition, userId, oldRank, newRank));
        }
    }
}
