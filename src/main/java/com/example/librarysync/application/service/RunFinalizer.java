package com.example.librarysync.application.service;

import com.example.librarysync.application.task.SyncTaskHandler;
import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.FinalizePayload;
import com.example.librarysync.application.task.payload.SweepPayload;
import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.common.util.GeometricMeanUtil;
import com.example.librarysync.domain.enumtype.SyncRunStatus;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import com.example.librarysync.infrastructure.persistence.mapper.SyncBatchLedgerMapper;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handles {@code FINALIZE}. Batches may still be in flight when the last page is counted, so the
 * finalizer re-enqueues itself until the ledger holds every expected batch, then computes the
 * geometric mean and closes the run.
 */
@Service
public class RunFinalizer implements SyncTaskHandler<FinalizePayload> {

    private static final Logger log = LoggerFactory.getLogger(RunFinalizer.class);

    private final SyncAccountMapper syncAccountMapper;
    private final SyncBatchLedgerMapper syncBatchLedgerMapper;
    private final SyncTaskQueue syncTaskQueue;
    private final AppSyncProperties appSyncProperties;

    public RunFinalizer(SyncAccountMapper syncAccountMapper,
                        SyncBatchLedgerMapper syncBatchLedgerMapper,
                        SyncTaskQueue syncTaskQueue,
                        AppSyncProperties appSyncProperties) {
        this.syncAccountMapper = syncAccountMapper;
        this.syncBatchLedgerMapper = syncBatchLedgerMapper;
        this.syncTaskQueue = syncTaskQueue;
        this.appSyncProperties = appSyncProperties;
    }

    @Override
    public SyncTaskType getTaskType() {
        return SyncTaskType.FINALIZE;
    }

    @Override
    public Class<FinalizePayload> getPayloadType() {
        return FinalizePayload.class;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void handle(FinalizePayload payload) {
        finalizeRun(payload);
    }

    /**
     * @return true when the run was closed by this call
     */
    public boolean finalizeRun(FinalizePayload payload) {
        Long accountId = payload.getAccountId();
        String runId = payload.getRunId();
        SyncAccountEntity account = syncAccountMapper.selectByIdForUpdate(accountId);
        if (account == null || !account.isSyncingNow() || !runId.equals(account.getSyncRunId())) {
            log.info("SYNC_FINALIZE_STALE accountId={} runId={}", accountId, runId);
            return false;
        }

        int landed = syncBatchLedgerMapper.countByRun(accountId, runId);
        if (landed < payload.getExpectedBatches()) {
            FinalizePayload retry = new FinalizePayload(accountId, runId, payload.getExpectedBatches(),
                    payload.isFullResync(), payload.getAttempt() + 1);
            syncTaskQueue.enqueueDelayed(SyncTaskType.FINALIZE, retry, appSyncProperties.getFinalizeRetryDelayMs());
            log.info("SYNC_FINALIZE_RESCHEDULED accountId={} runId={} landed={} expected={} attempt={}",
                    accountId, runId, landed, payload.getExpectedBatches(), retry.getAttempt());
            return false;
        }

        List<String> partialProducts = syncBatchLedgerMapper.selectPartialProducts(accountId, runId);
        long trackCount = account.getTrackCount() == null ? 0L : account.getTrackCount();
        long meanDurationMs = trackCount <= 0
                ? 0L
                : GeometricMeanUtil.roundedMean(GeometricMeanUtil.multiply(partialProducts), trackCount);

        LocalDateTime finishedAt = LocalDateTime.now();
        syncAccountMapper.markFinalized(accountId, runId, meanDurationMs, finishedAt,
                SyncRunStatus.SUCCEEDED.name());
        syncBatchLedgerMapper.deleteByAccount(accountId);

        if (payload.isFullResync()) {
            syncTaskQueue.enqueue(SyncTaskType.SWEEP,
                    new SweepPayload(accountId, runId, account.getSyncStartedAt()));
        }
        long elapsedMs = account.getSyncStartedAt() == null
                ? -1L
                : Duration.between(account.getSyncStartedAt(), finishedAt).toMillis();
        log.info("SYNC_RUN_FINALIZED accountId={} runId={} batches={} trackCount={} deleted={} merged={} meanDurationMs={} elapsedMs={}",
                accountId, runId, landed, trackCount, account.getDeletedCount(), account.getMergedCount(),
                meanDurationMs, elapsedMs);
        return true;
    }
}
