package com.incentives.engine.repository.impl;

import com.incentives.engine.model.Notification;
import com.incentives.engine.repository.NotificationRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class JsonNotificationRepository extends JsonDocumentStore<Notification> implements NotificationRepository {

    public JsonNotificationRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "notifications").toString(), Notification.class);
    }

    @Override
    protected String partitionOf(Notification notification) {
        return notification.getUserId();
    }

    @Override
    protected String idOf(Notification notification) {
        return notification.getId();
    }

    @Override
    public void saveAll(Collection<Notification> notifications) {
        Map<String, List<Notification>> byUser = notifications.stream()
            .collect(Collectors.groupingBy(Notification::getUserId));
        byUser.forEach(this::putAll);
    }

    @Override
    public List<Notification> findByUserId(String userId) {
        return list(userId).stream()
            .sorted(Comparator.comparing(Notification::getCreatedAt,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
            .toList();
    }

    @Override
    public Optional<Notification> markRead(String userId, String notificationId, Instant readAt) {
        if (userId == null || notificationId == null) {
            return Optional.empty();
        }
        return compute(userId, notificationId, notification -> {
            notification.setRead(true);
            notification.setReadAt(readAt);
            return notification;
        });
    }
}
