package com.incentives.engine.exception;

public class InvalidRequestException extends IncentivesException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
