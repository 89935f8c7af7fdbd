package com.example.librarysync.application.service;

import com.example.librarysync.application.task.SyncTaskHandler;
import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.AggregatePayload;
import com.example.librarysync.application.task.payload.FinalizePayload;
import com.example.librarysync.domain.enumtype.AggregateOutcome;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.entity.SyncBatchLedgerEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import com.example.librarysync.infrastructure.persistence.mapper.SyncBatchLedgerMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handles {@code AGGREGATE}: folds one batch into the run totals exactly once per fingerprint.
 * All reads and writes happen under the account row lock.
 */
@Service
public class RunAggregator implements SyncTaskHandler<AggregatePayload> {

    private static final Logger log = LoggerFactory.getLogger(RunAggregator.class);

    private final SyncAccountMapper syncAccountMapper;
    private final SyncBatchLedgerMapper syncBatchLedgerMapper;
    private final SyncTaskQueue syncTaskQueue;

    public RunAggregator(SyncAccountMapper syncAccountMapper,
                         SyncBatchLedgerMapper syncBatchLedgerMapper,
                         SyncTaskQueue syncTaskQueue) {
        this.syncAccountMapper = syncAccountMapper;
        this.syncBatchLedgerMapper = syncBatchLedgerMapper;
        this.syncTaskQueue = syncTaskQueue;
    }

    @Override
    public SyncTaskType getTaskType() {
        return SyncTaskType.AGGREGATE;
    }

    @Override
    public Class<AggregatePayload> getPayloadType() {
        return AggregatePayload.class;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void handle(AggregatePayload payload) {
        aggregate(payload);
    }

    public AggregateOutcome aggregate(AggregatePayload payload) {
        Long accountId = payload.getAccountId();
        SyncAccountEntity account = syncAccountMapper.selectByIdForUpdate(accountId);
        if (account == null || !account.isSyncingNow() || !payload.getRunId().equals(account.getSyncRunId())) {
            log.info("SYNC_BATCH_AGGREGATE_STALE accountId={} runId={} batchNum={}",
                    accountId, payload.getRunId(), payload.getBatchNum());
            return AggregateOutcome.STALE;
        }
        if (syncBatchLedgerMapper.countByFingerprint(accountId, payload.getFingerprint()) > 0) {
            log.info("SYNC_BATCH_DUPLICATE accountId={} runId={} batchNum={} fingerprint={}",
                    accountId, payload.getRunId(), payload.getBatchNum(), payload.getFingerprint());
            return AggregateOutcome.DUPLICATE;
        }

        SyncBatchLedgerEntity ledger = new SyncBatchLedgerEntity();
        ledger.setAccountId(accountId);
        ledger.setRunId(payload.getRunId());
        ledger.setFingerprint(payload.getFingerprint());
        ledger.setBatchNum(payload.getBatchNum());
        ledger.setPartialProduct(payload.getPartialProduct());
        ledger.setTrackDelta(payload.getTrackDelta());
        syncBatchLedgerMapper.insert(ledger);
        syncAccountMapper.applyBatchContribution(accountId, payload.getRunId(),
                payload.getTrackDelta(), payload.getNumDeletes(), payload.getNumMerges());

        if (payload.isLastPage()) {
            syncTaskQueue.enqueue(SyncTaskType.FINALIZE, new FinalizePayload(
                    accountId, payload.getRunId(), payload.getBatchNum(), payload.isFullResync(), 0));
        }
        log.info("SYNC_BATCH_COUNTED accountId={} runId={} batchNum={} trackDelta={} lastPage={}",
                accountId, payload.getRunId(), payload.getBatchNum(), payload.getTrackDelta(), payload.isLastPage());
        return AggregateOutcome.COUNTED;
    }
}
