package com.example.librarysync.application.task;

import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.domain.enumtype.SyncTaskStatus;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.entity.SyncTaskEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncTaskMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Durable task queue on the {@code sync_task} table. Enqueueing inside a transaction commits or
 * rolls back together with the caller's other writes.
 */
@Component
public class SyncTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(SyncTaskQueue.class);

    private final SyncTaskMapper syncTaskMapper;
    private final AppSyncProperties appSyncProperties;
    private final ObjectMapper objectMapper;

    public SyncTaskQueue(SyncTaskMapper syncTaskMapper,
                         AppSyncProperties appSyncProperties,
                         ObjectMapper objectMapper) {
        this.syncTaskMapper = syncTaskMapper;
        this.appSyncProperties = appSyncProperties;
        this.objectMapper = objectMapper;
    }

    public Long enqueue(SyncTaskType taskType, SyncTaskPayload payload) {
        return enqueueDelayed(taskType, payload, 0L);
    }

    public Long enqueueDelayed(SyncTaskType taskType, SyncTaskPayload payload, long delayMs) {
        SyncTaskEntity task = new SyncTaskEntity();
        task.setQueueName(appSyncProperties.getQueueName());
        task.setTaskType(taskType.name());
        task.setPayload(serialize(payload));
        task.setStatus(SyncTaskStatus.PENDING.name());
        task.setAttempts(0);
        task.setMaxAttempts(Math.max(1, appSyncProperties.getMaxAttempts()));
        LocalDateTime availableAt = LocalDateTime.now();
        if (delayMs > 0) {
            availableAt = availableAt.plusNanos(delayMs * 1_000_000L);
        }
        task.setAvailableAt(availableAt);
        syncTaskMapper.insert(task);
        log.debug("SYNC_TASK_ENQUEUED taskId={} taskType={} accountId={} runId={} delayMs={}",
                task.getId(), taskType, payload.getAccountId(), payload.getRunId(), delayMs);
        return task.getId();
    }

    private String serialize(SyncTaskPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Task payload serialization failed: "
                    + payload.getClass().getSimpleName(), e);
        }
    }
}
