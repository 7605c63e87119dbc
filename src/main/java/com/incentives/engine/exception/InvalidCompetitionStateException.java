package com.incentives.engine.exception;

import com.incentives.engine.model.CompetitionStatus;

/**
 * Raised when a lifecycle operation is attempted from the wrong status. Nothing has
 * been written when this is thrown.
 */
public class InvalidCompetitionStateException extends IncentivesException {
    private final String competitionId;
    private final CompetitionStatus currentStatus;

    public InvalidCompetitionStateException(String competitionId, CompetitionStatus currentStatus, String message) {
        super(message, "INVALID_COMPETITION_STATE");
        this.competitionId = competitionId;
        this.currentStatus = currentStatus;
    }

    public String getCompetitionId() {
        return competitionId;
    }

    public CompetitionStatus getCurrentStatus() {
        return currentStatus;
    }
}
