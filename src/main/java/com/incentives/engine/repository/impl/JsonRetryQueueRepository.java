package com.incentives.engine.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incentives.engine.config.IncentivesProperties;
import com.incentives.engine.exception.StorageException;
import com.incentives.engine.model.RetryQueueItem;
import com.incentives.engine.repository.RetryQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending live leaderboard writes, persisted to a single JSON file so they survive restarts.
 */
@Repository
public class JsonRetryQueueRepository implements RetryQueueRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonRetryQueueRepository.class);
    private static final String QUEUE_FILE = "retry-queue.json";

    private final String dataDirectory;
    private final int maxRetryCount;
    private final ObjectMapper objectMapper;
    private final Queue<RetryQueueItem> queue = new ConcurrentLinkedQueue<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public JsonRetryQueueRepository(IncentivesProperties properties) {
        this(properties.getStorage().getRoot(), properties.getLiveLeaderboard().getMaxRetries());
    }

    public JsonRetryQueueRepository(String storageRoot, int maxRetryCount) {
        this.dataDirectory = Paths.get(storageRoot, "retry-queue").toString();
        this.maxRetryCount = maxRetryCount;
        this.objectMapper = JsonDocumentStore.createObjectMapper();
        initializeDirectory();
        loadQueue();
    }

    private void initializeDirectory() {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create data directory: " + dataDirectory, e);
        }
    }

    private void loadQueue() {
        File queueFile = new File(dataDirectory, QUEUE_FILE);
        if (!queueFile.exists()) {
            return;
        }
        try {
            List<RetryQueueItem> items = objectMapper.readValue(
                queueFile,
                new TypeReference<List<RetryQueueItem>>() {}
            );
            if (items == null) {
                return;
            }
            items.stream()
                .filter(Objects::nonNull)
                .filter(this::hasRetriesLeft)
                .forEach(queue::offer);
            logger.info("Loaded {} pending live leaderboard writes from {}", queue.size(), queueFile);
        } catch (IOException e) {
            // Only mirror writes are lost; participants stay in the document store
            logger.error("Failed to load retry queue from {}, starting empty", queueFile, e);
        }
    }

    private void persistQueue() {
        lock.lock();
        try {
            File queueFile = new File(dataDirectory, QUEUE_FILE);
            List<RetryQueueItem> items = new ArrayList<>(queue);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(queueFile, items);
        } catch (IOException e) {
            throw new StorageException("Failed to persist retry queue", e);
        } finally {
            lock.unlock();
        }
    }

    private boolean hasRetriesLeft(RetryQueueItem item) {
        return item.getRetryCount() == null || item.getRetryCount() < maxRetryCount;
    }

    @Override
    public void enqueue(RetryQueueItem item) {
        if (item == null) {
            throw new IllegalArgumentException("RetryQueueItem cannot be null");
        }
        if (item.getRetryCount() == null) {
            item.setRetryCount(0);
        }
        if (item.getCreatedAt() == null) {
            item.setCreatedAt(Instant.now());
        }
        queue.offer(item);
        persistQueue();
    }

    @Override
    public List<RetryQueueItem> dequeue(int maxItems) {
        if (maxItems <= 0) {
            return Collections.emptyList();
        }

        List<RetryQueueItem> items = new ArrayList<>();
        boolean changed = false;
        while (items.size() < maxItems) {
            RetryQueueItem item = queue.poll();
            if (item == null) {
                break;
            }
            changed = true;
            if (!hasRetriesLeft(item)) {
                logger.warn("Dropping live leaderboard write for competition {} user {} after {} retries",
                    item.getCompetitionId(), item.getUserId(), item.getRetryCount());
                continue;
            }
            items.add(item);
        }

        if (changed) {
            persistQueue();
        }
        return items;
    }

    @Override
    public void remove(RetryQueueItem item) {
        if (item == null) {
            return;
        }
        if (queue.remove(item)) {
            persistQueue();
        }
    }

    public int size() {
        return queue.size();
    }
}
