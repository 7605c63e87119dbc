package com.incentives.engine.repository;

import com.incentives.engine.model.Metric;

import java.util.Optional;

public interface MetricRepository {
    Metric save(Metric metric);
    Optional<Metric> findById(String metricId);
    Optional<Metric> findBySlug(String slug);
}
