package com.incentives.engine.service;

import com.incentives.engine.config.IncentivesProperties;
import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.exception.NotificationNotFoundException;
import com.incentives.engine.model.Notification;
import com.incentives.engine.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Notification inbox of a user. The engine only writes rows; reading and marking them
 * read is all a client can do.
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final IncentivesProperties properties;

    @Autowired
    public NotificationService(NotificationRepository notificationRepository, IncentivesProperties properties) {
        this.notificationRepository = notificationRepository;
        this.properties = properties;
    }

    /**
     * Newest first. A null or non-positive limit uses the configured default.
     */
    public List<Notification> getNotifications(String userId, boolean unreadOnly, Integer limit) {
        validateUserId(userId);
        int effectiveLimit = limit == null || limit <= 0 ? properties.getNotifications().getDefaultLimit() : limit;
        return notificationRepository.findByUserId(userId).stream()
            .filter(notification -> !unreadOnly || !notification.isRead())
            .limit(effectiveLimit)
            .toList();
    }

    public long unreadCount(String userId) {
        validateUserId(userId);
        return notificationRepository.findByUserId(userId).stream()
            .filter(notification -> !notification.isRead())
            .count();
    }

    public Notification markRead(String notificationId, String userId) {
        validateUserId(userId);
        if (notificationId == null || notificationId.trim().isEmpty()) {
            throw new InvalidRequestException("NotificationId cannot be null or empty");
        }
        Notification notification = notificationRepository.markRead(userId, notificationId, Instant.now())
            .orElseThrow(() -> new NotificationNotFoundException(notificationId));
        logger.debug("Marked notification {} read for user {}", notificationId, userId);
        return notification;
    }

    private void validateUserId(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidRequestException("UserId cannot be null or empty");
        }
    }
}
