package com.incentives.engine.repository.impl;

import com.incentives.engine.model.Metric;
import com.incentives.engine.repository.MetricRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Optional;

@Repository
public class JsonMetricRepository extends JsonDocumentStore<Metric> implements MetricRepository {

    private static final String PARTITION = "metrics";

    public JsonMetricRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "metrics").toString(), Metric.class);
    }

    @Override
    protected String partitionOf(Metric metric) {
        return PARTITION;
    }

    @Override
    protected String idOf(Metric metric) {
        return metric.getId();
    }

    @Override
    public Metric save(Metric metric) {
        if (metric == null || metric.getId() == null || metric.getSlug() == null) {
            throw new IllegalArgumentException("Metric id and slug are required");
        }
        return put(metric);
    }

    @Override
    public Optional<Metric> findById(String metricId) {
        return get(PARTITION, metricId);
    }

    @Override
    public Optional<Metric> findBySlug(String slug) {
        if (slug == null || slug.trim().isEmpty()) {
            return Optional.empty();
        }
        return list(PARTITION).stream()
            .filter(metric -> slug.equals(metric.getSlug()))
            .findFirst();
    }
}
