package com.incentives.engine.dto;

import com.incentives.engine.model.GameEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameEventResult {
    private String eventId;
    private GameEventType type;
    private int points;

    @Builder.Default
    private List<String> metricSlugs = new ArrayList<>();

    @Builder.Default
    private List<EventRecordResult> recorded = new ArrayList<>();

    // metric slug -> failure message
    @Builder.Default
    private Map<String, String> errors = new LinkedHashMap<>();
}
