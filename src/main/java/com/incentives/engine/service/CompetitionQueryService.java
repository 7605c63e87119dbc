package com.incentives.engine.service;

import com.incentives.engine.dto.LeaderboardEntry;
import com.incentives.engine.dto.LeaderboardView;
import com.incentives.engine.exception.CompetitionNotFoundException;
import com.incentives.engine.exception.InvalidCompetitionStateException;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionResult;
import com.incentives.engine.model.CompetitionStatus;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.RankedParticipant;
import com.incentives.engine.model.Rule;
import com.incentives.engine.model.ThresholdRuleConfig;
import com.incentives.engine.model.TopNRuleConfig;
import com.incentives.engine.model.UserBadge;
import com.incentives.engine.repository.CompetitionRepository;
import com.incentives.engine.repository.ParticipantRepository;
import com.incentives.engine.repository.ResultRepository;
import com.incentives.engine.repository.RuleRepository;
import com.incentives.engine.repository.UserBadgeRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class CompetitionQueryService {

    static final int MAX_LEADERBOARD_LIMIT = 1000;

    private final CompetitionRepository competitionRepository;
    private final ParticipantRepository participantRepository;
    private final RuleRepository ruleRepository;
    private final ResultRepository resultRepository;
    private final UserBadgeRepository userBadgeRepository;
    private final RankEngine rankEngine;
    private final LiveLeaderboard liveLeaderboard;

    @Autowired
    public CompetitionQueryService(
            CompetitionRepository competitionRepository,
            ParticipantRepository participantRepository,
            RuleRepository ruleRepository,
            ResultRepository resultRepository,
            UserBadgeRepository userBadgeRepository,
            RankEngine rankEngine,
            LiveLeaderboard liveLeaderboard) {
        this.competitionRepository = competitionRepository;
        this.participantRepository = participantRepository;
        this.ruleRepository = ruleRepository;
        this.resultRepository = resultRepository;
        this.userBadgeRepository = userBadgeRepository;
        this.rankEngine = rankEngine;
        this.liveLeaderboard = liveLeaderboard;
    }

    public Competition getCompetition(String competitionId) {
        return competitionRepository.findById(competitionId)
            .orElseThrow(() -> new CompetitionNotFoundException(competitionId));
    }

    /**
     * Ranked page of the competition with prize-position and threshold-gap annotations.
     */
    public LeaderboardView getLeaderboard(String competitionId, int limit, int offset) {
        if (limit <= 0 || limit > MAX_LEADERBOARD_LIMIT) {
            throw new InvalidRequestException("Limit must be between 1 and " + MAX_LEADERBOARD_LIMIT);
        }
        if (offset < 0) {
            throw new InvalidRequestException("Offset cannot be negative");
        }
        Competition competition = getCompetition(competitionId);
        List<Rule> rules = ruleRepository.findByCompetitionId(competitionId);
        int prizePositions = prizePositions(rules);
        List<Long> thresholds = thresholds(rules);

        Map<String, Participant> participants = participantRepository.findByCompetitionId(competitionId).stream()
            .collect(Collectors.toMap(Participant::getUserId, Function.identity()));

        List<LeaderboardEntry> entries = liveLeaderboard.getTopN(competitionId, offset, limit).stream()
            .map(ranked -> toEntry(ranked, participants.get(ranked.getUserId()), prizePositions, thresholds))
            .toList();

        return LeaderboardView.builder()
            .competitionId(competitionId)
            .competitionName(competition.getName())
            .status(competition.getStatus())
            .totalParticipants(participants.size())
            .entries(entries)
            .build();
    }

    private LeaderboardEntry toEntry(RankedParticipant ranked, Participant participant, int prizePositions,
                                     List<Long> thresholds) {
        long value = ranked.getValue();
        Long gap = thresholds.stream()
            .filter(threshold -> threshold > value)
            .findFirst()
            .map(threshold -> threshold - value)
            .orElse(null);

        return LeaderboardEntry.builder()
            .userId(ranked.getUserId())
            .userName(participant != null ? participant.getUserName() : null)
            .rank(ranked.getRank())
            .value(value)
            .percentile(participant != null ? participant.getPercentile() : null)
            .activityCount(participant != null ? participant.getActivityCount() : 0L)
            .inPrizePosition(ranked.getRank() <= prizePositions)
            .gapToQualify(gap)
            .build();
    }

    private static int prizePositions(List<Rule> rules) {
        return rules.stream()
            .filter(rule -> rule.getConfig() instanceof TopNRuleConfig)
            .mapToInt(rule -> ((TopNRuleConfig) rule.getConfig()).getTopN())
            .max()
            .orElse(0);
    }

    // Ascending, so the first one above a value is the nearest
    private static List<Long> thresholds(List<Rule> rules) {
        return rules.stream()
            .filter(rule -> rule.getConfig() instanceof ThresholdRuleConfig)
            .map(rule -> ((ThresholdRuleConfig) rule.getConfig()).getThresholdValue())
            .sorted(Comparator.naturalOrder())
            .toList();
    }

    public List<Participant> getParticipants(String competitionId) {
        getCompetition(competitionId);
        return rankEngine.ranking(competitionId);
    }

    public List<CompetitionResult> getResults(String competitionId) {
        Competition competition = getCompetition(competitionId);
        if (competition.getStatus() != CompetitionStatus.EVALUATING
                && competition.getStatus() != CompetitionStatus.COMPLETED) {
            throw new InvalidCompetitionStateException(competitionId, competition.getStatus(),
                "Results are not available while competition " + competitionId + " is "
                    + competition.getStatus().label());
        }
        return resultRepository.findByCompetitionId(competitionId);
    }

    public List<UserBadge> getUserBadges(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidRequestException("UserId cannot be null or empty");
        }
        return userBadgeRepository.findByUserId(userId).stream()
            .sorted(Comparator.comparing(UserBadge::getEarnedAt,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
            .toList();
    }
}
