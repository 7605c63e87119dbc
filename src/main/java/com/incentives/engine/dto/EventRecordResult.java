package com.incentives.engine.dto;

import com.incentives.engine.model.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of recording one metric event. {@code recorded} is false when the metric slug
 * was unknown and nothing was stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventRecordResult {
    private boolean recorded;
    private String eventId;
    private String metricId;

    @Builder.Default
    private List<String> affectedCompetitions = new ArrayList<>();

    @Builder.Default
    private List<Notification> notifications = new ArrayList<>();

    @Builder.Default
    private List<RankMovement> rankChanges = new ArrayList<>();

    @Builder.Default
    private List<Qualification> qualifications = new ArrayList<>();

    public static EventRecordResult ignored() {
        return EventRecordResult.builder().recorded(false).build();
    }
}
