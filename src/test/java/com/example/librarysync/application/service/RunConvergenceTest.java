package com.example.librarysync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.librarysync.application.task.SyncTaskPayload;
import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.AggregatePayload;
import com.example.librarysync.application.task.payload.FinalizePayload;
import com.example.librarysync.application.task.payload.LoadBatchPayload;
import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.entity.SyncBatchLedgerEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import com.example.librarysync.infrastructure.persistence.mapper.SyncBatchLedgerMapper;
import com.example.librarysync.infrastructure.persistence.mapper.TrackMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

/**
 * Drives whole runs through batch persistence, aggregation and finalization against a ledger and
 * account row kept in memory, delivering tasks in random order and redelivering some of them.
 */
class RunConvergenceTest {

    private static final String RUN_ID = "run-7";
    private static final int MAX_STEPS = 2000;
    private static final int MAX_REDELIVERIES = 8;

    private ExecutorService batchWriteExecutor;

    private SyncAccountEntity account;
    private List<SyncBatchLedgerEntity> ledger;
    private List<QueuedTask> pending;
    private int finalizations;
    private int sweeps;

    private BatchPersister persister;
    private RunAggregator aggregator;
    private RunFinalizer finalizer;

    @BeforeEach
    void setUp() {
        batchWriteExecutor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        batchWriteExecutor.shutdownNow();
    }

    @Test
    void shouldFinalizeOnceWhateverTheDeliveryOrder() {
        List<List<Map<String, Object>>> pages = Arrays.asList(
                Arrays.asList(record("a", 1000L, false), record("b", 4000L, false)),
                Collections.emptyList(),
                Arrays.asList(record("c", 2000L, false), record("d", 9000L, true)),
                Collections.emptyList());

        for (long seed = 1; seed <= 25; seed++) {
            runScenario(pages, seed);

            assertEquals(1, finalizations, "seed " + seed);
            assertEquals(1, sweeps, "seed " + seed);
            assertFalse(account.isSyncingNow(), "seed " + seed);
            assertEquals("SUCCEEDED", account.getLastSyncStatus(), "seed " + seed);
            assertEquals(3L, account.getTrackCount().longValue(), "seed " + seed);
            assertEquals(1L, account.getDeletedCount().longValue(), "seed " + seed);
            assertEquals(3L, account.getMergedCount().longValue(), "seed " + seed);
            // cube root of 1000 * 4000 * 2000
            assertEquals(2000L, account.getMeanDurationMs().longValue(), "seed " + seed);
            assertTrue(ledger.isEmpty(), "seed " + seed);
        }
    }

    @Test
    void shouldFinalizeRunEndingInConsecutiveEmptyPages() {
        List<List<Map<String, Object>>> pages = Arrays.asList(
                Arrays.asList(record("a", 1000L, false), record("b", 4000L, false)),
                Collections.emptyList(),
                Collections.emptyList());

        for (long seed = 1; seed <= 10; seed++) {
            runScenario(pages, seed);

            assertEquals(1, finalizations, "seed " + seed);
            assertEquals(2L, account.getTrackCount().longValue(), "seed " + seed);
            assertEquals(2000L, account.getMeanDurationMs().longValue(), "seed " + seed);
        }
    }

    @Test
    void shouldFinalizeRunOfOnlyEmptyPagesWithZeroMean() {
        runScenario(Arrays.asList(Collections.emptyList(), Collections.emptyList()), 3L);

        assertEquals(1, finalizations);
        assertEquals(0L, account.getTrackCount().longValue());
        assertEquals(0L, account.getMeanDurationMs().longValue());
    }

    private void runScenario(List<List<Map<String, Object>>> pages, long seed) {
        wire();
        Random random = new Random(seed);
        for (int i = 0; i < pages.size(); i++) {
            boolean lastPage = i == pages.size() - 1;
            pending.add(new QueuedTask(SyncTaskType.LOAD_BATCH,
                    new LoadBatchPayload(1L, RUN_ID, null, new ArrayList<>(pages.get(i)), i + 1, lastPage)));
        }

        int redeliveries = 0;
        int steps = 0;
        while (!pending.isEmpty()) {
            assertTrue(++steps <= MAX_STEPS, "run did not converge, seed " + seed);
            QueuedTask task = pending.remove(random.nextInt(pending.size()));
            boolean redeliverable = task.type == SyncTaskType.LOAD_BATCH || task.type == SyncTaskType.AGGREGATE;
            if (redeliverable && redeliveries < MAX_REDELIVERIES && random.nextInt(3) == 0) {
                pending.add(task);
                redeliveries++;
            }
            dispatch(task);
        }
    }

    private void dispatch(QueuedTask task) {
        switch (task.type) {
            case LOAD_BATCH:
                persister.handle((LoadBatchPayload) task.payload);
                break;
            case AGGREGATE:
                aggregator.aggregate((AggregatePayload) task.payload);
                break;
            case FINALIZE:
                if (finalizer.finalizeRun((FinalizePayload) task.payload)) {
                    finalizations++;
                }
                break;
            case SWEEP:
                sweeps++;
                break;
            default:
                throw new IllegalStateException("Unexpected task " + task.type);
        }
    }

    private void wire() {
        account = new SyncAccountEntity();
        account.setId(1L);
        account.setSyncing(true);
        account.setSyncRunId(RUN_ID);
        account.setSyncStartedAt(LocalDateTime.of(2024, 6, 1, 0, 0));
        account.setTrackCount(0L);
        account.setDeletedCount(0L);
        account.setMergedCount(0L);
        account.setMeanDurationMs(0L);
        ledger = new ArrayList<>();
        pending = new ArrayList<>();
        finalizations = 0;
        sweeps = 0;

        SyncAccountMapper syncAccountMapper = mock(SyncAccountMapper.class);
        when(syncAccountMapper.selectById(1L)).thenAnswer(invocation -> account);
        when(syncAccountMapper.selectByIdForUpdate(1L)).thenAnswer(invocation -> account);
        when(syncAccountMapper.applyBatchContribution(anyLong(), anyString(), anyInt(), anyInt(), anyInt()))
                .thenAnswer(invocation -> {
                    if (!isActive(invocation.getArgument(1))) {
                        return 0;
                    }
                    int trackDelta = invocation.getArgument(2);
                    int numDeletes = invocation.getArgument(3);
                    int numMerges = invocation.getArgument(4);
                    account.setTrackCount(account.getTrackCount() + trackDelta);
                    account.setDeletedCount(account.getDeletedCount() + numDeletes);
                    account.setMergedCount(account.getMergedCount() + numMerges);
                    return 1;
                });
        when(syncAccountMapper.markFinalized(anyLong(), anyString(), anyLong(), any(), anyString()))
                .thenAnswer(invocation -> {
                    if (!isActive(invocation.getArgument(1))) {
                        return 0;
                    }
                    account.setSyncing(false);
                    account.setMeanDurationMs(invocation.getArgument(2));
                    account.setSyncFinishedAt(invocation.getArgument(3));
                    account.setLastSyncStatus(invocation.getArgument(4));
                    return 1;
                });

        SyncBatchLedgerMapper syncBatchLedgerMapper = mock(SyncBatchLedgerMapper.class);
        when(syncBatchLedgerMapper.insert(any(SyncBatchLedgerEntity.class))).thenAnswer(invocation -> {
            SyncBatchLedgerEntity row = invocation.getArgument(0);
            boolean taken = ledger.stream().anyMatch(existing -> existing.getFingerprint().equals(row.getFingerprint()));
            if (taken) {
                throw new IllegalStateException("Duplicate fingerprint " + row.getFingerprint());
            }
            ledger.add(row);
            return 1;
        });
        when(syncBatchLedgerMapper.countByFingerprint(anyLong(), anyString())).thenAnswer(invocation -> {
            String fingerprint = invocation.getArgument(1);
            return (int) ledger.stream().filter(row -> row.getFingerprint().equals(fingerprint)).count();
        });
        when(syncBatchLedgerMapper.countByRun(anyLong(), anyString())).thenAnswer(invocation -> {
            String runId = invocation.getArgument(1);
            return (int) ledger.stream().filter(row -> row.getRunId().equals(runId)).count();
        });
        when(syncBatchLedgerMapper.selectPartialProducts(anyLong(), anyString())).thenAnswer(invocation -> {
            String runId = invocation.getArgument(1);
            return ledger.stream()
                    .filter(row -> row.getRunId().equals(runId))
                    .sorted(Comparator.comparing(SyncBatchLedgerEntity::getBatchNum))
                    .map(SyncBatchLedgerEntity::getPartialProduct)
                    .collect(Collectors.toList());
        });
        when(syncBatchLedgerMapper.deleteByAccount(anyLong())).thenAnswer(invocation -> {
            int removed = ledger.size();
            ledger.clear();
            return removed;
        });

        SyncTaskQueue syncTaskQueue = mock(SyncTaskQueue.class);
        when(syncTaskQueue.enqueue(any(SyncTaskType.class), any(SyncTaskPayload.class))).thenAnswer(invocation -> {
            pending.add(new QueuedTask(invocation.getArgument(0), invocation.getArgument(1)));
            return (long) pending.size();
        });
        when(syncTaskQueue.enqueueDelayed(any(SyncTaskType.class), any(SyncTaskPayload.class), anyLong()))
                .thenAnswer(invocation -> {
                    pending.add(new QueuedTask(invocation.getArgument(0), invocation.getArgument(1)));
                    return (long) pending.size();
                });

        AppSyncProperties properties = new AppSyncProperties();
        properties.setFinalizeRetryDelayMs(10);
        persister = new BatchPersister(new RecordClassifier(), new TrackMaterializer(), mock(TrackMapper.class),
                syncAccountMapper, syncTaskQueue, batchWriteExecutor,
                new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class));
        aggregator = new RunAggregator(syncAccountMapper, syncBatchLedgerMapper, syncTaskQueue);
        finalizer = new RunFinalizer(syncAccountMapper, syncBatchLedgerMapper, syncTaskQueue, properties);
    }

    private boolean isActive(String runId) {
        return account.isSyncingNow() && runId.equals(account.getSyncRunId());
    }

    private Map<String, Object> record(String id, long duration, boolean deleted) {
        Map<String, Object> record = new HashMap<>();
        record.put("id", id);
        record.put("title", "Title " + id);
        record.put("durationMillis", duration);
        record.put("creationTimestamp", 1L);
        record.put("lastModifiedTimestamp", 2L);
        record.put("recentTimestamp", 1L);
        record.put("deleted", deleted);
        return record;
    }

    private static final class QueuedTask {

        private final SyncTaskType type;
        private final SyncTaskPayload payload;

        private QueuedTask(SyncTaskType type, SyncTaskPayload payload) {
            this.type = type;
            this.payload = payload;
        }
    }
}
