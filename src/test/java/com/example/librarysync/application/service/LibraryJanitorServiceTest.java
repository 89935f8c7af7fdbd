package com.example.librarysync.application.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.SweepPayload;
import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.mapper.TrackMapper;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LibraryJanitorServiceTest {

    private static final LocalDateTime CUTOFF = LocalDateTime.of(2024, 3, 1, 0, 0);

    private TrackMapper trackMapper;
    private SyncTaskQueue syncTaskQueue;
    private LibraryJanitorService janitor;

    @BeforeEach
    void setUp() {
        trackMapper = mock(TrackMapper.class);
        syncTaskQueue = mock(SyncTaskQueue.class);
        AppSyncProperties properties = new AppSyncProperties();
        properties.setSweepBatchSize(750);
        janitor = new LibraryJanitorService(trackMapper, syncTaskQueue, properties);
    }

    @Test
    void shouldContinueSweepWhileChunksAreFull() {
        SweepPayload payload = new SweepPayload(1L, "run-1", CUTOFF);
        when(trackMapper.deleteUntouchedBefore(1L, CUTOFF, 750)).thenReturn(750);

        janitor.handle(payload);

        verify(syncTaskQueue).enqueue(SyncTaskType.SWEEP, payload);
    }

    @Test
    void shouldStopAfterPartialChunk() {
        when(trackMapper.deleteUntouchedBefore(1L, CUTOFF, 750)).thenReturn(12);

        janitor.handle(new SweepPayload(1L, "run-1", CUTOFF));

        verify(syncTaskQueue, never()).enqueue(any(), any());
    }

    @Test
    void shouldSkipSweepWithoutCutoff() {
        janitor.handle(new SweepPayload(1L, "run-1", null));

        verify(trackMapper, never()).deleteUntouchedBefore(anyLong(), any(), anyInt());
        verify(syncTaskQueue, never()).enqueue(eq(SyncTaskType.SWEEP), any());
    }
}
