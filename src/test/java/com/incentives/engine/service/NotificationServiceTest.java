package com.incentives.engine.service;

import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.exception.NotificationNotFoundException;
import com.incentives.engine.model.Notification;
import com.incentives.engine.model.NotificationType;
import com.incentives.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotificationServiceTest {

    private static final Instant BASE = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(tempDir);
        List<Notification> notifications = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            notifications.add(Notification.builder()
                .id("n-" + i)
                .userId("user-1")
                .competitionId("comp-1")
                .type(NotificationType.THRESHOLD_APPROACHING)
                .title("Almost There!")
                .createdAt(BASE.plusSeconds(i))
                .build());
        }
        fixture.notificationRepository.saveAll(notifications);
    }

    @Test
    void testGetNotifications_NewestFirstWithLimit() {
        List<Notification> notifications = fixture.notificationService.getNotifications("user-1", false, 3);

        assertEquals(List.of("n-4", "n-3", "n-2"), notifications.stream().map(Notification::getId).toList());
    }

    @Test
    void testGetNotifications_DefaultLimitWhenMissing() {
        fixture.properties.getNotifications().setDefaultLimit(2);

        assertEquals(2, fixture.notificationService.getNotifications("user-1", false, null).size());
    }

    @Test
    void testMarkRead_RemovesFromUnread() {
        // Act
        Notification read = fixture.notificationService.markRead("n-1", "user-1");

        // Assert
        assertTrue(read.isRead());
        assertNotNull(read.getReadAt());
        assertEquals(4, fixture.notificationService.unreadCount("user-1"));
        assertTrue(fixture.notificationService.getNotifications("user-1", true, null).stream()
            .noneMatch(n -> "n-1".equals(n.getId())));
    }

    @Test
    void testMarkRead_OtherUsersNotificationIsNotFound() {
        assertThrows(NotificationNotFoundException.class,
            () -> fixture.notificationService.markRead("n-1", "user-2"));
        assertThrows(NotificationNotFoundException.class,
            () -> fixture.notificationService.markRead("n-missing", "user-1"));
    }

    @Test
    void testValidation() {
        assertThrows(InvalidRequestException.class, () -> fixture.notificationService.getNotifications(null, false, 5));
        assertThrows(InvalidRequestException.class, () -> fixture.notificationService.markRead("", "user-1"));
    }
}
