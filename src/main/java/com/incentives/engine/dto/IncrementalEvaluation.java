package com.incentives.engine.dto;

import com.incentives.engine.model.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the rules of one competition produced for one participant update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncrementalEvaluation {

    @Builder.Default
    private List<Notification> notifications = new ArrayList<>();

    @Builder.Default
    private List<Qualification> qualifications = new ArrayList<>();

    public boolean hasQualifications() {
        return qualifications != null && !qualifications.isEmpty();
    }
}
