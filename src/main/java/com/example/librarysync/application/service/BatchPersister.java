package com.example.librarysync.application.service;

import com.example.librarysync.application.task.SyncTaskHandler;
import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.AggregatePayload;
import com.example.librarysync.application.task.payload.LoadBatchPayload;
import com.example.librarysync.common.exception.MalformedRecordException;
import com.example.librarysync.common.util.HashUtil;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.domain.model.ClassifiedBatch;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.entity.TrackEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import com.example.librarysync.infrastructure.persistence.mapper.TrackMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Handles {@code LOAD_BATCH}: applies one catalog page to the track table and hands its
 * contribution to the aggregator as an {@code AGGREGATE} task. Re-running the same page is safe:
 * upserts overwrite, deletes are idempotent and the fingerprint is stable. Empty pages are
 * fingerprinted by run and batch number so that two of them in one run stay distinct.
 */
@Service
public class BatchPersister implements SyncTaskHandler<LoadBatchPayload> {

    private static final Logger log = LoggerFactory.getLogger(BatchPersister.class);
    private static final int UPSERT_CHUNK_SIZE = 200;

    private final RecordClassifier recordClassifier;
    private final TrackMaterializer trackMaterializer;
    private final TrackMapper trackMapper;
    private final SyncAccountMapper syncAccountMapper;
    private final SyncTaskQueue syncTaskQueue;
    private final ExecutorService batchWriteExecutor;
    private final MeterRegistry meterRegistry;

    public BatchPersister(RecordClassifier recordClassifier,
                          TrackMaterializer trackMaterializer,
                          TrackMapper trackMapper,
                          SyncAccountMapper syncAccountMapper,
                          SyncTaskQueue syncTaskQueue,
                          @Qualifier("batchWriteExecutor") ExecutorService batchWriteExecutor,
                          ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.recordClassifier = recordClassifier;
        this.trackMaterializer = trackMaterializer;
        this.trackMapper = trackMapper;
        this.syncAccountMapper = syncAccountMapper;
        this.syncTaskQueue = syncTaskQueue;
        this.batchWriteExecutor = batchWriteExecutor;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    @Override
    public SyncTaskType getTaskType() {
        return SyncTaskType.LOAD_BATCH;
    }

    @Override
    public Class<LoadBatchPayload> getPayloadType() {
        return LoadBatchPayload.class;
    }

    @Override
    public void handle(LoadBatchPayload payload) {
        long startedAtNanos = System.nanoTime();
        Long accountId = payload.getAccountId();
        SyncAccountEntity account = syncAccountMapper.selectById(accountId);
        if (account == null || !account.isSyncingNow() || !payload.getRunId().equals(account.getSyncRunId())) {
            log.info("SYNC_BATCH_STALE accountId={} runId={} batchNum={}, run no longer active",
                    accountId, payload.getRunId(), payload.getBatchNum());
            return;
        }

        List<Map<String, Object>> records = payload.getRecords() == null
                ? Collections.emptyList()
                : payload.getRecords();
        ClassifiedBatch batch = recordClassifier.classify(records, payload.getWatermarkMicros());

        LocalDateTime touchedAt = LocalDateTime.now();
        List<TrackEntity> merges = new ArrayList<>(batch.getNumMerges());
        for (Map<String, Object> record : batch.getMerges()) {
            merges.add(trackMaterializer.materialize(accountId, record, touchedAt));
        }
        List<String> deleteIds = new ArrayList<>(batch.getNumDeletes());
        for (Map<String, Object> record : batch.getDeletes()) {
            deleteIds.add(CatalogRecords.id(record));
        }
        BigInteger partialProduct = partialProduct(batch);

        writeBatch(accountId, merges, deleteIds);

        String fingerprint = HashUtil.batchFingerprint(batch.getAllIds(), payload.getRunId(), payload.getBatchNum());
        AggregatePayload aggregate = new AggregatePayload(
                accountId,
                payload.getRunId(),
                batch.getNumRetained(),
                partialProduct.toString(),
                fingerprint,
                payload.isLastPage(),
                payload.getBatchNum(),
                batch.getNumDeletes(),
                batch.getNumMerges(),
                payload.getWatermarkMicros() == null);
        syncTaskQueue.enqueue(SyncTaskType.AGGREGATE, aggregate);

        incrementCounter("library.sync.batch.records", records.size(), "bucket", "all");
        incrementCounter("library.sync.batch.records", batch.getNumMerges(), "bucket", "merge");
        incrementCounter("library.sync.batch.records", batch.getNumDeletes(), "bucket", "delete");
        incrementCounter("library.sync.batch.records", batch.getNumSkips(), "bucket", "skip");
        recordDuration("library.sync.batch.latency", System.nanoTime() - startedAtNanos);
        log.info("SYNC_BATCH_PERSISTED accountId={} runId={} batchNum={} lastPage={} merges={} deletes={} skips={} fingerprint={}",
                accountId, payload.getRunId(), payload.getBatchNum(), payload.isLastPage(),
                batch.getNumMerges(), batch.getNumDeletes(), batch.getNumSkips(), fingerprint);
    }

    /**
     * Product of the durations of every record that stays in the library. One for an empty page.
     */
    BigInteger partialProduct(ClassifiedBatch batch) {
        BigInteger product = BigInteger.ONE;
        product = multiplyDurations(product, batch.getMerges());
        return multiplyDurations(product, batch.getSkips());
    }

    private BigInteger multiplyDurations(BigInteger product, List<Map<String, Object>> records) {
        BigInteger result = product;
        for (Map<String, Object> record : records) {
            Long duration = CatalogRecords.longValue(record, CatalogRecords.DURATION);
            if (duration == null || duration <= 0) {
                throw new MalformedRecordException(CatalogRecords.id(record), CatalogRecords.DURATION,
                        "expected a positive integer but was " + record.get(CatalogRecords.DURATION));
            }
            result = result.multiply(BigInteger.valueOf(duration));
        }
        return result;
    }

    private void writeBatch(Long accountId, List<TrackEntity> merges, List<String> deleteIds) {
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (int from = 0; from < merges.size(); from += UPSERT_CHUNK_SIZE) {
            List<TrackEntity> chunk = merges.subList(from, Math.min(merges.size(), from + UPSERT_CHUNK_SIZE));
            writes.add(CompletableFuture.runAsync(() -> trackMapper.upsertBatch(chunk), batchWriteExecutor));
        }
        if (!deleteIds.isEmpty()) {
            writes.add(CompletableFuture.runAsync(
                    () -> trackMapper.deleteByRemoteIds(accountId, deleteIds), batchWriteExecutor));
        }
        if (writes.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            incrementCounter("library.sync.batch.write.failed", 1);
            throw new IllegalStateException("Batch write failed for account " + accountId
                    + ": " + cause.getMessage(), cause);
        }
    }

    private void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
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
