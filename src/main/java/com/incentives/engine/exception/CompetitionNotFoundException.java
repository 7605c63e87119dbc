package com.incentives.engine.exception;

public class CompetitionNotFoundException extends IncentivesException {
    public CompetitionNotFoundException(String competitionId) {
        super("Competition not found: " + competitionId, "COMPETITION_NOT_FOUND");
    }
}
