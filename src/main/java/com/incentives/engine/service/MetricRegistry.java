package com.incentives.engine.service;

import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.Metric;
import com.incentives.engine.repository.MetricRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class MetricRegistry {

    private final MetricRepository metricRepository;

    @Autowired
    public MetricRegistry(MetricRepository metricRepository) {
        this.metricRepository = metricRepository;
    }

    public Optional<Metric> findBySlug(String slug) {
        return metricRepository.findBySlug(slug);
    }

    public Optional<Metric> findById(String metricId) {
        return metricRepository.findById(metricId);
    }

    public Metric register(Metric metric) {
        if (metric == null || metric.getSlug() == null || metric.getSlug().trim().isEmpty()) {
            throw new InvalidRequestException("Metric slug cannot be null or empty");
        }
        metricRepository.findBySlug(metric.getSlug())
            .filter(existing -> !existing.getId().equals(metric.getId()))
            .ifPresent(existing -> {
                throw new InvalidRequestException("Metric slug " + metric.getSlug() + " is already registered");
            });
        return metricRepository.save(metric);
    }
}
