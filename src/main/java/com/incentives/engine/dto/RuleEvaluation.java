package com.incentives.engine.dto;

import com.incentives.engine.model.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What one incremental rule check produced for one participant update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleEvaluation {
    private boolean qualified;
    private String detail;

    @Builder.Default
    private List<Notification> notifications = new ArrayList<>();

    public static RuleEvaluation none() {
        return RuleEvaluation.builder().build();
    }

    public static RuleEvaluation notifyOnly(Notification notification) {
        List<Notification> notifications = new ArrayList<>();
        notifications.add(notification);
        return RuleEvaluation.builder().notifications(notifications).build();
    }

    public static RuleEvaluation qualified(Notification notification, String detail) {
        RuleEvaluation evaluation = notifyOnly(notification);
        evaluation.setQualified(true);
        evaluation.setDetail(detail);
        return evaluation;
    }
}
