package com.incentives.engine.service;

import com.incentives.engine.model.BadgeAward;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionOutcome;
import com.incentives.engine.model.CompetitionResult;
import com.incentives.engine.model.ImprovementProgress;
import com.incentives.engine.model.LotteryEntry;
import com.incentives.engine.model.MilestoneProgress;
import com.incentives.engine.model.MilestoneTier;
import com.incentives.engine.model.Notification;
import com.incentives.engine.model.NotificationData;
import com.incentives.engine.model.NotificationType;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.RankChange;
import com.incentives.engine.model.ThresholdProgress;
import com.incentives.engine.model.UserBadge;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Builds notification records. Delivery is somebody else's job; these are only the rows.
 */
@Component
public class NotificationFactory {

    public Notification thresholdReached(Competition competition, Participant participant,
                                         long threshold, long currentValue, int pointsEarned) {
        return create(competition, participant.getUserId(), NotificationType.THRESHOLD_REACHED,
            "Threshold Reached!",
            "You hit " + threshold + "! You've qualified for rewards.",
            ThresholdProgress.builder()
                .threshold(threshold)
                .currentValue(currentValue)
                .pointsEarned(pointsEarned)
                .build());
    }

    public Notification thresholdApproaching(Competition competition, Participant participant,
                                             long threshold, long currentValue) {
        long gap = threshold - currentValue;
        return create(competition, participant.getUserId(), NotificationType.THRESHOLD_APPROACHING,
            "Almost There!",
            "Just " + gap + " more to qualify!",
            ThresholdProgress.builder()
                .threshold(threshold)
                .currentValue(currentValue)
                .gap(gap)
                .build());
    }

    public Notification milestoneReached(Competition competition, Participant participant, MilestoneTier tier) {
        return create(competition, participant.getUserId(), NotificationType.MILESTONE_REACHED,
            capitalize(tier.getTier()) + " Unlocked!",
            "You reached " + tier.getValue() + "! +" + tier.getPointsAward() + " points",
            MilestoneProgress.builder()
                .tier(tier.getTier())
                .value(tier.getValue())
                .pointsEarned(tier.getPointsAward())
                .build());
    }

    public Notification improvementAchieved(Competition competition, Participant participant, long baseline,
                                            long currentValue, double improvement, double required,
                                            int pointsEarned) {
        return create(competition, participant.getUserId(), NotificationType.IMPROVEMENT_ACHIEVED,
            "Personal Best!",
            String.format(Locale.ROOT, "You beat your baseline by %.1f%%! Goal was %s%%.",
                improvement, formatPercent(required)),
            ImprovementProgress.builder()
                .baselineValue(baseline)
                .currentValue(currentValue)
                .improvementPercent(improvement)
                .requiredPercent(required)
                .pointsEarned(pointsEarned)
                .build());
    }

    public Notification improvementApproaching(Competition competition, Participant participant, long baseline,
                                               long currentValue, double improvement, double required) {
        return create(competition, participant.getUserId(), NotificationType.IMPROVEMENT_APPROACHING,
            "Almost There!",
            String.format(Locale.ROOT, "Just %.1f%% more to beat your baseline!", required - improvement),
            ImprovementProgress.builder()
                .baselineValue(baseline)
                .currentValue(currentValue)
                .improvementPercent(improvement)
                .requiredPercent(required)
                .build());
    }

    public Notification lotteryQualified(Competition competition, Participant participant,
                                         long threshold, long currentValue, int winnerCount) {
        return create(competition, participant.getUserId(), NotificationType.LOTTERY_QUALIFIED,
            "You're In The Draw!",
            "You hit " + threshold + " and are now entered in the lottery!",
            LotteryEntry.builder()
                .threshold(threshold)
                .currentValue(currentValue)
                .winnerCount(winnerCount)
                .build());
    }

    public Notification rankImproved(Competition competition, String userId, int oldRank, int newRank) {
        return create(competition, userId, NotificationType.RANK_IMPROVED,
            "You're now #" + newRank + "!",
            "You moved up from #" + oldRank + ". Keep pushing!",
            RankChange.builder().oldRank(oldRank).newRank(newRank).build());
    }

    public Notification competitionResult(Competition competition, CompetitionResult result) {
        return create(competition, result.getUserId(), NotificationType.COMPETITION_RESULT,
            "Competition Complete!",
            "You finished #" + result.getFinalRank() + " in " + competition.getName()
                + "! +" + result.getPointsAwarded() + " points",
            CompetitionOutcome.builder()
                .competitionId(competition.getId())
                .competitionName(competition.getName())
                .finalRank(result.getFinalRank())
                .finalValue(result.getFinalValue())
                .pointsAwarded(result.getPointsAwarded())
                .qualificationReason(result.getQualificationReason())
                .build());
    }

    public Notification competitionEnded(Competition competition, Participant participant, int finalRank,
                                         String unit) {
        return create(competition, participant.getUserId(), NotificationType.COMPETITION_ENDED,
            "Competition Ended",
            competition.getName() + " has ended. You finished #" + finalRank + " with "
                + participant.getCurrentValue() + " " + unit + ".",
            CompetitionOutcome.builder()
                .competitionId(competition.getId())
                .competitionName(competition.getName())
                .finalRank(finalRank)
                .finalValue(participant.getCurrentValue())
                .build());
    }

    public Notification badgeEarned(Competition competition, UserBadge badge) {
        return create(competition, badge.getUserId(), NotificationType.BADGE_EARNED,
            "Badge Earned: " + badge.getBadgeName(),
            "You earned the " + badge.getBadgeName() + " badge for " + badge.getEarnedReason() + "!",
            BadgeAward.builder()
                .badgeId(badge.getBadgeId())
                .badgeName(badge.getBadgeName())
                .badgeIcon(badge.getBadgeIcon())
                .badgeTier(badge.getBadgeTier())
                .competitionId(competition.getId())
                .earnedReason(badge.getEarnedReason())
                .build());
    }

    private Notification create(Competition competition, String userId, NotificationType type,
                                String title, String body, NotificationData data) {
        return Notification.builder()
            .id(UUID.randomUUID().toString())
            .userId(userId)
            .competitionId(competition.getId())
            .type(type)
            .title(title)
            .body(body)
            .data(data)
            .read(false)
            .createdAt(Instant.now())
            .build();
    }

    public static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }

    public static String formatPercent(double percent) {
        if (percent == Math.rint(percent)) {
            return Long.toString((long) percent);
        }
        return String.format(Locale.ROOT, "%.1f", percent);
    }
}
