package com.incentives.engine.service;

import com.incentives.engine.dto.RankRecomputation;
import com.incentives.engine.model.Participant;
import com.incentives.engine.repository.ParticipantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns ranks within a competition. Higher value ranks first; equal values are ordered
 * by who reached the value first (unknown last), then by user id.
 */
@Service
public class RankEngine {

    private static final Logger logger = LoggerFactory.getLogger(RankEngine.class);

    public static final Comparator<Participant> RANKING_ORDER = Comparator
        .comparingLong(Participant::getCurrentValue).reversed()
        .thenComparing(Participant::getValueReachedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
        .thenComparing(Participant::getUserId);

    private final ParticipantRepository participantRepository;

    @Autowired
    public RankEngine(ParticipantRepository participantRepository) {
        this.participantRepository = participantRepository;
    }

    /**
     * All participants of the competition in rank order. This is also the final ranking used at settlement.
     */
    public List<Participant> ranking(String competitionId) {
        return participantRepository.findByCompetitionId(competitionId).stream()
            .sorted(RANKING_ORDER)
            .toList();
    }

    public RankRecomputation recompute(String competitionId, String focusUserId) {
        List<Participant> ranked = ranking(competitionId);
        int total = ranked.size();

        List<Participant> changed = new ArrayList<>();
        Integer focusRank = null;
        Integer focusPreviousRank = null;

        for (int i = 0; i < total; i++) {
            Participant participant = ranked.get(i);
            int newRank = i + 1;
            Integer oldRank = participant.getRank();

            if (focusUserId != null && focusUserId.equals(participant.getUserId())) {
                focusRank = newRank;
                focusPreviousRank = oldRank;
            }

            if (oldRank == null || oldRank != newRank) {
                participant.setPreviousRank(oldRank);
                participant.setRank(newRank);
                participant.setPercentile(percentile(newRank, total));
                changed.add(participant);
            }
        }

        if (!changed.isEmpty()) {
            participantRepository.saveAll(competitionId, changed);
        }
        logger.debug("Recomputed ranks for competition {}: {} of {} participants changed",
            competitionId, changed.size(), total);

        return RankRecomputation.builder()
            .competitionId(competitionId)
            .updatedCount(changed.size())
            .focusUserRank(focusRank)
            .focusPreviousRank(focusPreviousRank)
            .build();
    }

    static double percentile(int rank, int total) {
        if (total == 0) {
            return 0.0;
        }
        return (total - rank + 1) / (double) total * 100.0;
    }
}
