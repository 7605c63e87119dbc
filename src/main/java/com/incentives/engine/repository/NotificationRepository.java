package com.incentives.engine.repository;

import com.incentives.engine.model.Notification;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface NotificationRepository {
    void saveAll(Collection<Notification> notifications);

    /** Newest first. */
    List<Notification> findByUserId(String userId);

    Optional<Notification> markRead(String userId, String notificationId, Instant readAt);
}
