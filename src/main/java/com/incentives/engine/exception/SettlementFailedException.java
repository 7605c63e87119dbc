package com.incentives.engine.exception;

public class SettlementFailedException extends IncentivesException {
    public SettlementFailedException(String competitionId, Throwable cause) {
        super("Settlement failed for competition " + competitionId
            + "; competition left in evaluating", "SETTLEMENT_FAILED", cause);
    }
}
