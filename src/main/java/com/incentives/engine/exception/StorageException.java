package com.incentives.engine.exception;

public class StorageException extends IncentivesException {
    public StorageException(String message, Throwable cause) {
        super(message, "STORAGE_ERROR", cause);
    }
}
