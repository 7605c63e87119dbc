package com.incentives.engine.service;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Partial Fisher-Yates shuffle driven by a {@link Random} seeded from the SHA-256 of the seed string.
 */
@Component
public class SeededShuffleSampler implements DeterministicSampler {

    @Override
    public <T> List<T> sample(String seed, List<T> population, int k) {
        if (seed == null) {
            throw new IllegalArgumentException("Seed cannot be null");
        }
        if (k < 0 || k > population.size()) {
            throw new IllegalArgumentException("Cannot draw " + k + " from a population of " + population.size());
        }

        Random random = new Random(seedToLong(seed));
        List<T> pool = new ArrayList<>(population);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
        }
        return new ArrayList<>(pool.subList(0, k));
    }

    static long seedToLong(String seed) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
