package com.incentives.engine.exception;

public class IncentivesException extends RuntimeException {
    private final String errorCode;
    
    public IncentivesException(String message) {
        super(message);
        this.errorCode = "INCENTIVES_ERROR";
    }
    
    public IncentivesException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public IncentivesException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "INCENTIVES_ERROR";
    }
    
    public IncentivesException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
