package com.incentives.engine.repository;

import com.incentives.engine.model.RetryQueueItem;

import java.util.List;

public interface RetryQueueRepository {
    void enqueue(RetryQueueItem item);
    List<RetryQueueItem> dequeue(int maxItems);
    void remove(RetryQueueItem item);
}
