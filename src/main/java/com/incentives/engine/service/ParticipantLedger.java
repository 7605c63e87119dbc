package com.incentives.engine.service;

import com.incentives.engine.model.Competition;
import com.incentives.engine.model.Participant;
import com.incentives.engine.repository.ParticipantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Running value of each participant. Every delta is a single read-modify-write on the
 * participant row, applied under the store's partition lock.
 */
@Service
public class ParticipantLedger {

    private static final Logger logger = LoggerFactory.getLogger(ParticipantLedger.class);

    private final ParticipantRepository participantRepository;

    @Autowired
    public ParticipantLedger(ParticipantRepository participantRepository) {
        this.participantRepository = participantRepository;
    }

    /**
     * Returns the updated participant, or empty when the user is not enrolled in the competition.
     */
    public Optional<Participant> applyDelta(Competition competition, String userId, long delta) {
        Instant now = Instant.now();
        Optional<Participant> updated = participantRepository.update(competition.getId(), userId, participant -> {
            participant.setPreviousValue(participant.getCurrentValue());
            participant.setCurrentValue(participant.getCurrentValue() + delta);
            participant.setPeakValue(Math.max(participant.getPeakValue(), participant.getCurrentValue()));
            participant.setActivityCount(participant.getActivityCount() + 1);
            participant.setLastActivityAt(now);
            if (delta != 0) {
                participant.setValueReachedAt(now);
            }
            participant.setVersion(participant.getVersion() + 1);
            return participant;
        });

        if (updated.isEmpty()) {
            logger.debug("User {} is not enrolled in competition {}, event ignored", userId, competition.getId());
        }
        return updated;
    }
}
