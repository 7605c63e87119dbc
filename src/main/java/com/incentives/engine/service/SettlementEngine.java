package com.incentives.engine.service;

import com.incentives.engine.config.CompetitionLocks;
import com.incentives.engine.dto.Award;
import com.incentives.engine.dto.SettlementSummary;
import com.incentives.engine.exception.CompetitionNotFoundException;
import com.incentives.engine.exception.InvalidCompetitionStateException;
import com.incentives.engine.exception.SettlementFailedException;
import com.incentives.engine.model.Badge;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionResult;
import com.incentives.engine.model.CompetitionStatus;
import com.incentives.engine.model.Metric;
import com.incentives.engine.model.Notification;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.UserBadge;
import com.incentives.engine.repository.BadgeCatalog;
import com.incentives.engine.repository.CompetitionRepository;
import com.incentives.engine.repository.NotificationRepository;
import com.incentives.engine.repository.PointsLedger;
import com.incentives.engine.repository.ResultRepository;
import com.incentives.engine.repository.RuleRepository;
import com.incentives.engine.repository.UserBadgeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Closes a competition: {@code active -> evaluating -> completed}. Results, points,
 * badges and notifications are produced once, from the final ranking.
 */
@Service
public class SettlementEngine {

    private static final Logger logger = LoggerFactory.getLogger(SettlementEngine.class);

    private final CompetitionRepository competitionRepository;
    private final RuleRepository ruleRepository;
    private final ResultRepository resultRepository;
    private final UserBadgeRepository userBadgeRepository;
    private final NotificationRepository notificationRepository;
    private final PointsLedger pointsLedger;
    private final BadgeCatalog badgeCatalog;
    private final MetricRegistry metricRegistry;
    private final RankEngine rankEngine;
    private final RuleEvaluator ruleEvaluator;
    private final NotificationFactory notificationFactory;
    private final SeasonStandingsService seasonStandingsService;
    private final CompetitionLocks competitionLocks;

    @Autowired
    public SettlementEngine(
            CompetitionRepository competitionRepository,
            RuleRepository ruleRepository,
            ResultRepository resultRepository,
            UserBadgeRepository userBadgeRepository,
            NotificationRepository notificationRepository,
            PointsLedger pointsLedger,
            BadgeCatalog badgeCatalog,
            MetricRegistry metricRegistry,
            RankEngine rankEngine,
            RuleEvaluator ruleEvaluator,
            NotificationFactory notificationFactory,
            SeasonStandingsService seasonStandingsService,
            CompetitionLocks competitionLocks) {
        this.competitionRepository = competitionRepository;
        this.ruleRepository = ruleRepository;
        this.resultRepository = resultRepository;
        this.userBadgeRepository = userBadgeRepository;
        this.notificationRepository = notificationRepository;
        this.pointsLedger = pointsLedger;
        this.badgeCatalog = badgeCatalog;
        this.metricRegistry = metricRegistry;
        this.rankEngine = rankEngine;
        this.ruleEvaluator = ruleEvaluator;
        this.notificationFactory = notificationFactory;
        this.seasonStandingsService = seasonStandingsService;
        this.competitionLocks = competitionLocks;
    }

    /**
     * Ends an active competition and settles every rule.
     *
     * @throws CompetitionNotFoundException if the competition does not exist
     * @throws InvalidCompetitionStateException if it is not active; nothing is written
     * @throws SettlementFailedException if settlement fails after the competition moved
     *         to evaluating; it stays there for operator action
     */
    public SettlementSummary endAndEvaluate(String competitionId) {
        Competition competition = competitionRepository.findById(competitionId)
            .orElseThrow(() -> new CompetitionNotFoundException(competitionId));

        Snapshot snapshot = competitionLocks.withLock(competitionId, () -> beginEvaluation(competitionId));
        logger.info("Competition {} moved to evaluating with {} participants and {} rules",
            competitionId, snapshot.ranking.size(), snapshot.rules.size());

        try {
            return settle(snapshot);
        } catch (RuntimeException e) {
            logger.error("Settlement of competition {} ({}) failed, leaving it in evaluating",
                competitionId, competition.getName(), e);
            throw new SettlementFailedException(competitionId, e);
        }
    }

    private Snapshot beginEvaluation(String competitionId) {
        Instant now = Instant.now();
        Competition evaluating = competitionRepository.compareAndSetStatus(competitionId, CompetitionStatus.ACTIVE,
                c -> c.toBuilder()
                    .status(CompetitionStatus.EVALUATING)
                    .evaluationStartedAt(now)
                    .updatedAt(now)
                    .build())
            .orElseThrow(() -> invalidState(competitionId));

        // Stored ranks are brought in line with the final ranking before it is read
        rankEngine.recompute(competitionId, null);
        return new Snapshot(evaluating,
            ruleRepository.findByCompetitionId(competitionId),
            rankEngine.ranking(competitionId));
    }

    private InvalidCompetitionStateException invalidState(String competitionId) {
        Competition current = competitionRepository.findById(competitionId)
            .orElseThrow(() -> new CompetitionNotFoundException(competitionId));
        return new InvalidCompetitionStateException(competitionId, current.getStatus(),
            "Competition " + competitionId + " is " + current.getStatus().label() + ", not active");
    }

    private SettlementSummary settle(Snapshot snapshot) {
        Competition competition = snapshot.competition;
        String competitionId = competition.getId();
        List<Participant> ranking = snapshot.ranking;
        Instant now = Instant.now();

        List<CompetitionResult> results = evaluateRules(competition, snapshot.rules, ranking, now);
        resultRepository.saveAll(competitionId, results);

        List<Notification> notifications = new ArrayList<>();
        int badgesAwarded = 0;
        for (CompetitionResult result : results) {
            if (result.getPointsAwarded() > 0) {
                pointsLedger.incrementPoints(result.getUserId(), result.getPointsAwarded());
            }
            if (result.getBadgeId() != null) {
                Optional<UserBadge> badge = awardBadge(result, now);
                if (badge.isPresent()) {
                    badgesAwarded++;
                    notifications.add(notificationFactory.badgeEarned(competition, badge.get()));
                }
            }
            notifications.add(notificationFactory.competitionResult(competition, result));
        }

        Set<String> qualifiedUsers = new HashSet<>();
        results.forEach(r -> qualifiedUsers.add(r.getUserId()));
        String unit = metricRegistry.findById(competition.getMetricId()).map(Metric::getUnit).orElse("points");
        for (int i = 0; i < ranking.size(); i++) {
            Participant participant = ranking.get(i);
            if (!qualifiedUsers.contains(participant.getUserId())) {
                notifications.add(notificationFactory.competitionEnded(competition, participant, i + 1, unit));
            }
        }

        if (!notifications.isEmpty()) {
            notificationRepository.saveAll(notifications);
        }

        Instant completedAt = Instant.now();
        competitionRepository.compareAndSetStatus(competitionId, CompetitionStatus.EVALUATING,
                c -> c.toBuilder()
                    .status(CompetitionStatus.COMPLETED)
                    .evaluatedAt(completedAt)
                    .participantCount(ranking.size())
                    .qualifiedCount(qualifiedUsers.size())
                    .updatedAt(completedAt)
                    .build())
            .orElseThrow(() -> new IllegalStateException(
                "Competition " + competitionId + " left evaluating during settlement"));

        logger.info("Competition {} completed: {} results, {} badges, {} notifications",
            competitionId, results.size(), badgesAwarded, notifications.size());

        if (competition.getSeasonId() != null) {
            rebuildSeason(competition);
        }

        return SettlementSummary.builder()
            .competitionId(competitionId)
            .competitionName(competition.getName())
            .resultsCount(results.size())
            .badgesAwarded(badgesAwarded)
            .notificationsSent(notifications.size())
            .build();
    }

    private List<CompetitionResult> evaluateRules(Competition competition, List<Rule> rules,
                                                  List<Participant> ranking, Instant now) {
        Map<String, Integer> finalRanks = new HashMap<>();
        for (int i = 0; i < ranking.size(); i++) {
            finalRanks.put(ranking.get(i).getUserId(), i + 1);
        }

        Set<String> awardedCombos = new HashSet<>();
        List<CompetitionResult> results = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.getType() == null) {
                logger.warn("Rule {} in competition {} has no type, skipping", rule.getId(), competition.getId());
                continue;
            }
            List<Award> awards = ruleEvaluator.evaluatorFor(rule.getType()).settle(competition, rule, ranking);
            for (Award award : awards) {
                Participant participant = award.getParticipant();
                if (!awardedCombos.add(participant.getUserId() + "|" + rule.getId())) {
                    continue;
                }
                results.add(toResult(competition, rule, award, finalRanks.get(participant.getUserId()),
                    ranking.size(), now));
            }
        }
        return results;
    }

    private CompetitionResult toResult(Competition competition, Rule rule, Award award, Integer finalRank,
                                       int participantCount, Instant now) {
        Participant participant = award.getParticipant();
        int rank = finalRank != null ? finalRank : 0;
        return CompetitionResult.builder()
            .id(UUID.randomUUID().toString())
            .competitionId(competition.getId())
            .userId(participant.getUserId())
            .userName(participant.getUserName() != null ? participant.getUserName() : "Unknown")
            .ruleId(rule.getId())
            .ruleType(rule.getType())
            .finalRank(rank)
            .finalValue(participant.getCurrentValue())
            .finalPercentile(rank > 0 ? RankEngine.percentile(rank, participantCount) : 0.0)
            .qualificationReason(award.getQualificationReason())
            .pointsAwarded(award.getPointsAwarded())
            .badgeId(award.getBadgeId())
            .rewardId(award.getRewardId())
            .improvementAchieved(award.getImprovementAchieved())
            .baselineValue(award.getBaselineValue())
            .fulfillmentStatus("pending")
            .createdAt(now)
            .build();
    }

    private Optional<UserBadge> awardBadge(CompetitionResult result, Instant now) {
        String userId = result.getUserId();
        String badgeId = result.getBadgeId();
        if (userBadgeRepository.existsByUserIdAndBadgeId(userId, badgeId)) {
            logger.debug("User {} already holds badge {}", userId, badgeId);
            return Optional.empty();
        }

        Optional<Badge> badge = badgeCatalog.getBadge(badgeId);
        if (badge.isEmpty()) {
            logger.warn("Badge {} not found in catalog, skipping award to user {}", badgeId, userId);
            return Optional.empty();
        }

        UserBadge userBadge = userBadgeRepository.save(UserBadge.builder()
            .id(UUID.randomUUID().toString())
            .userId(userId)
            .badgeId(badgeId)
            .badgeName(badge.get().getName())
            .badgeIcon(badge.get().getIcon())
            .badgeTier(badge.get().getTier())
            .competitionId(result.getCompetitionId())
            .earnedReason(result.getQualificationReason())
            .earnedAt(now)
            .build());
        logger.info("Awarded badge {} to user {}", badgeId, userId);
        return Optional.of(userBadge);
    }

    private void rebuildSeason(Competition competition) {
        try {
            seasonStandingsService.rebuild(competition.getSeasonId());
        } catch (RuntimeException e) {
            // Completion stands; standings can be rebuilt on demand
            logger.error("Failed to rebuild standings of season {} after competition {} completed",
                competition.getSeasonId(), competition.getId(), e);
        }
    }

    private static final class Snapshot {
        private final Competition competition;
        private final List<Rule> rules;
        private final List<Participant> ranking;

        private Snapshot(Competition competition, List<Rule> rules, List<Participant> ranking) {
            this.competition = competition;
            this.rules = rules;
            this.ranking = ranking;
        }
    }
}
