package com.incentives.engine.exception;

public class NotificationNotFoundException extends IncentivesException {
    public NotificationNotFoundException(String notificationId) {
        super("Notification not found: " + notificationId, "NOTIFICATION_NOT_FOUND");
    }
}
