package com.incentives.engine.repository.impl;

import com.incentives.engine.model.MetricEvent;
import com.incentives.engine.repository.MetricEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Repository
public class JsonMetricEventRepository extends JsonDocumentStore<MetricEvent> implements MetricEventRepository {

    public JsonMetricEventRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "metric-events").toString(), MetricEvent.class);
    }

    @Override
    protected String partitionOf(MetricEvent event) {
        return event.getMetricId();
    }

    @Override
    protected String idOf(MetricEvent event) {
        return event.getId();
    }

    @Override
    public MetricEvent save(MetricEvent event) {
        if (event == null || event.getId() == null || event.getMetricId() == null) {
            throw new IllegalArgumentException("MetricEvent id and metricId are required");
        }
        if (!putIfAbsent(event)) {
            throw new IllegalStateException("MetricEvent " + event.getId() + " already recorded");
        }
        return event;
    }

    @Override
    public List<MetricEvent> findByUserIdAndMetricIdSince(String userId, String metricId, Instant since) {
        return list(metricId).stream()
            .filter(event -> Objects.equals(userId, event.getUserId()))
            .filter(event -> since == null
                || (event.getCreatedAt() != null && !event.getCreatedAt().isBefore(since)))
            .toList();
    }
}
