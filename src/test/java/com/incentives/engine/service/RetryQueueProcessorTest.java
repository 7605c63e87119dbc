package com.incentives.engine.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryQueueProcessorTest {

    @Mock
    private LiveLeaderboard liveLeaderboard;

    @InjectMocks
    private RetryQueueProcessor retryQueueProcessor;

    @Test
    void testProcessRetryQueue_Delegates() {
        retryQueueProcessor.processRetryQueue();

        verify(liveLeaderboard).processRetryQueue();
    }

    @Test
    void testProcessRetryQueue_FailureDoesNotStopTheScheduler() {
        doThrow(new IllegalStateException("queue file locked")).when(liveLeaderboard).processRetryQueue();

        assertDoesNotThrow(() -> retryQueueProcessor.processRetryQueue());
    }
}
