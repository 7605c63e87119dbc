package com.incentives.engine.service;

import java.util.List;

/**
 * Picks {@code k} distinct elements from a population. The same seed and the same
 * population in the same order always yield the same picks.
 */
public interface DeterministicSampler {

    <T> List<T> sample(String seed, List<T> population, int k);
}
