package com.incentives.engine.repository;

import com.incentives.engine.model.Participant;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface ParticipantRepository {
    Participant save(Participant participant);
    void saveAll(String competitionId, Collection<Participant> participants);
    Optional<Participant> findByCompetitionIdAndUserId(String competitionId, String userId);
    List<Participant> findByCompetitionId(String competitionId);

    /**
     * Atomic read-modify-write of one participant row. Returns empty when the user is
     * not enrolled in the competition.
     */
    Optional<Participant> update(String competitionId, String userId, UnaryOperator<Participant> mutation);
}
