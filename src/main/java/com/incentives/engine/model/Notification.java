package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private String id;
    private String userId;
    private String competitionId;
    private NotificationType type;
    private String title;
    private String body;
    private NotificationData data;
    private boolean read;
    private Instant readAt;
    private Instant createdAt;
}
