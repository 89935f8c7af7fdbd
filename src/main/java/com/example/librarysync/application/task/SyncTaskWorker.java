package com.example.librarysync.application.task;

import com.example.librarysync.application.service.SyncRunAbortService;
import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.common.exception.NonRetriableSyncException;
import com.example.librarysync.common.logging.MdcKeys;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.entity.SyncTaskEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncTaskMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the task table, leases due tasks and runs them on the worker pool. A task that fails is
 * retried with exponential backoff; a non-retriable failure or an exhausted retry budget
 * dead-letters it and aborts the run it belongs to.
 */
@Component
public class SyncTaskWorker {

    private static final Logger log = LoggerFactory.getLogger(SyncTaskWorker.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final SyncTaskMapper syncTaskMapper;
    private final AppSyncProperties appSyncProperties;
    private final ObjectMapper objectMapper;
    private final SyncRunAbortService syncRunAbortService;
    private final ExecutorService syncTaskExecutor;
    private final Map<SyncTaskType, SyncTaskHandler<?>> handlers = new EnumMap<>(SyncTaskType.class);
    private final MeterRegistry meterRegistry;
    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    public SyncTaskWorker(SyncTaskMapper syncTaskMapper,
                          AppSyncProperties appSyncProperties,
                          ObjectMapper objectMapper,
                          SyncRunAbortService syncRunAbortService,
                          @Qualifier("syncTaskExecutor") ExecutorService syncTaskExecutor,
                          List<SyncTaskHandler<?>> handlerList,
                          ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.syncTaskMapper = syncTaskMapper;
        this.appSyncProperties = appSyncProperties;
        this.objectMapper = objectMapper;
        this.syncRunAbortService = syncRunAbortService;
        this.syncTaskExecutor = syncTaskExecutor;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        for (SyncTaskHandler<?> handler : handlerList) {
            SyncTaskHandler<?> previous = handlers.put(handler.getTaskType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for task type " + handler.getTaskType());
            }
        }
    }

    @Scheduled(fixedDelayString = "${app.sync.poll-interval-ms:1000}")
    public void poll() {
        int limit = claimLimit();
        if (limit <= 0) {
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        List<Long> candidates = syncTaskMapper.selectClaimableIds(appSyncProperties.getQueueName(), now, limit);
        if (candidates == null || candidates.isEmpty()) {
            return;
        }
        LocalDateTime lockedUntil = now.plusSeconds(appSyncProperties.getLeaseSeconds());
        for (Long taskId : candidates) {
            if (syncTaskMapper.claim(taskId, workerId, now, lockedUntil) != 1) {
                // another worker won the race
                continue;
            }
            SyncTaskEntity task = syncTaskMapper.selectById(taskId);
            if (task == null) {
                continue;
            }
            try {
                syncTaskExecutor.execute(() -> execute(task));
            } catch (RejectedExecutionException e) {
                log.warn("SYNC_TASK_REJECTED taskId={} taskType={}, lease will expire and redeliver",
                        taskId, task.getTaskType());
                return;
            }
        }
    }

    void execute(SyncTaskEntity task) {
        long startedAtNanos = System.nanoTime();
        MDC.put(MdcKeys.TASK_ID, String.valueOf(task.getId()));
        MDC.put(MdcKeys.TASK_TYPE, task.getTaskType());
        SyncTaskPayload payload = null;
        try {
            SyncTaskHandler<?> handler = resolveHandler(task.getTaskType());
            payload = objectMapper.readValue(task.getPayload(), handler.getPayloadType());
            MDC.put(MdcKeys.ACCOUNT_ID, String.valueOf(payload.getAccountId()));
            invoke(handler, payload);
            syncTaskMapper.markSucceeded(task.getId(), workerId);
            incrementCounter("library.sync.task.succeeded", "task_type", task.getTaskType());
            log.debug("SYNC_TASK_SUCCEEDED taskId={} attempts={}", task.getId(), task.getAttempts());
        } catch (Exception e) {
            onFailure(task, payload, e);
        } finally {
            recordDuration("library.sync.task.latency", System.nanoTime() - startedAtNanos,
                    "task_type", String.valueOf(task.getTaskType()));
            MDC.remove(MdcKeys.ACCOUNT_ID);
            MDC.remove(MdcKeys.TASK_TYPE);
            MDC.remove(MdcKeys.TASK_ID);
        }
    }

    long backoffMillis(int attempts) {
        int exponent = Math.min(Math.max(attempts - 1, 0), 30);
        long delay = appSyncProperties.getRetryBackoffMs() << exponent;
        if (delay <= 0 || delay > appSyncProperties.getRetryBackoffMaxMs()) {
            return appSyncProperties.getRetryBackoffMaxMs();
        }
        return delay;
    }

    private void onFailure(SyncTaskEntity task, SyncTaskPayload payload, Exception e) {
        int attempts = task.getAttempts() == null ? 1 : task.getAttempts();
        int maxAttempts = task.getMaxAttempts() == null ? appSyncProperties.getMaxAttempts() : task.getMaxAttempts();
        String error = truncate(e.getClass().getSimpleName() + ": " + e.getMessage());
        boolean nonRetriable = e instanceof NonRetriableSyncException || payload == null;

        if (nonRetriable || attempts >= maxAttempts) {
            syncTaskMapper.markDead(task.getId(), workerId, error);
            incrementCounter("library.sync.task.dead", "task_type", task.getTaskType());
            log.error("SYNC_TASK_DEAD taskId={} taskType={} attempts={} nonRetriable={}",
                    task.getId(), task.getTaskType(), attempts, nonRetriable, e);
            if (payload != null) {
                syncRunAbortService.abort(payload.getAccountId(), payload.getRunId(),
                        task.getTaskType() + " task " + task.getId() + " dead-lettered: " + error);
            }
            return;
        }

        long delayMs = backoffMillis(attempts);
        syncTaskMapper.markRetry(task.getId(), workerId,
                LocalDateTime.now().plusNanos(delayMs * 1_000_000L), error);
        incrementCounter("library.sync.task.retried", "task_type", task.getTaskType());
        log.warn("SYNC_TASK_RETRY taskId={} taskType={} attempts={} maxAttempts={} delayMs={} error={}",
                task.getId(), task.getTaskType(), attempts, maxAttempts, delayMs, error);
    }

    @SuppressWarnings("unchecked")
    private <P extends SyncTaskPayload> void invoke(SyncTaskHandler<P> handler, SyncTaskPayload payload) {
        handler.handle((P) payload);
    }

    private SyncTaskHandler<?> resolveHandler(String taskType) {
        SyncTaskHandler<?> handler = null;
        try {
            handler = handlers.get(SyncTaskType.valueOf(taskType));
        } catch (IllegalArgumentException e) {
            log.error("Unknown sync task type, taskType={}", taskType);
        }
        if (handler == null) {
            throw new IllegalStateException("No handler registered for task type " + taskType);
        }
        return handler;
    }

    private int claimLimit() {
        int limit = Math.max(1, appSyncProperties.getClaimBatchSize());
        if (syncTaskExecutor instanceof ThreadPoolExecutor) {
            ThreadPoolExecutor pool = (ThreadPoolExecutor) syncTaskExecutor;
            int idleThreads = pool.getMaximumPoolSize() - pool.getActiveCount();
            limit = Math.min(limit, Math.max(0, idleThreads) + pool.getQueue().remainingCapacity());
        }
        return limit;
    }

    private String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_ERROR_LENGTH);
    }

    private void incrementCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }
}
