package com.incentives.engine.repository.impl;

import com.incentives.engine.model.Participant;
import com.incentives.engine.repository.ParticipantRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Repository
public class JsonParticipantRepository extends JsonDocumentStore<Participant> implements ParticipantRepository {

    public JsonParticipantRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "participants").toString(), Participant.class);
    }

    @Override
    protected String partitionOf(Participant participant) {
        return participant.getCompetitionId();
    }

    @Override
    protected String idOf(Participant participant) {
        return participant.getUserId();
    }

    @Override
    public Participant save(Participant participant) {
        validateParticipant(participant);
        return put(participant);
    }

    @Override
    public void saveAll(String competitionId, Collection<Participant> participants) {
        participants.forEach(this::validateParticipant);
        putAll(competitionId, participants);
    }

    private void validateParticipant(Participant participant) {
        if (participant == null) {
            throw new IllegalArgumentException("Participant cannot be null");
        }
        if (participant.getCompetitionId() == null || participant.getCompetitionId().trim().isEmpty()) {
            throw new IllegalArgumentException("CompetitionId cannot be null or empty");
        }
        if (participant.getUserId() == null || participant.getUserId().trim().isEmpty()) {
            throw new IllegalArgumentException("UserId cannot be null or empty");
        }
    }

    @Override
    public Optional<Participant> findByCompetitionIdAndUserId(String competitionId, String userId) {
        return get(competitionId, userId);
    }

    @Override
    public List<Participant> findByCompetitionId(String competitionId) {
        return list(competitionId);
    }

    @Override
    public Optional<Participant> update(String competitionId, String userId, UnaryOperator<Participant> mutation) {
        if (competitionId == null || userId == null) {
            return Optional.empty();
        }
        return compute(competitionId, userId, mutation);
    }
}
