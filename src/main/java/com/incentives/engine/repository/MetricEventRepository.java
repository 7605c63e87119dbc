package com.incentives.engine.repository;

import com.incentives.engine.model.MetricEvent;

import java.time.Instant;
import java.util.List;

public interface MetricEventRepository {
    MetricEvent save(MetricEvent event);
    List<MetricEvent> findByUserIdAndMetricIdSince(String userId, String metricId, Instant since);
}
