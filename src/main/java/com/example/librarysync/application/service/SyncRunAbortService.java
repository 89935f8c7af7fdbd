package com.example.librarysync.application.service;

import com.example.librarysync.domain.enumtype.SyncRunStatus;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import com.example.librarysync.infrastructure.persistence.mapper.SyncBatchLedgerMapper;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ends a run that cannot complete. The watermark is left alone so the next run covers the same
 * window again.
 */
@Service
public class SyncRunAbortService {

    private static final Logger log = LoggerFactory.getLogger(SyncRunAbortService.class);

    private final SyncAccountMapper syncAccountMapper;
    private final SyncBatchLedgerMapper syncBatchLedgerMapper;

    public SyncRunAbortService(SyncAccountMapper syncAccountMapper,
                               SyncBatchLedgerMapper syncBatchLedgerMapper) {
        this.syncAccountMapper = syncAccountMapper;
        this.syncBatchLedgerMapper = syncBatchLedgerMapper;
    }

    /**
     * @return true when the run was still active and is now aborted
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean abort(Long accountId, String runId, String reason) {
        SyncAccountEntity account = syncAccountMapper.selectByIdForUpdate(accountId);
        if (account == null) {
            log.warn("SYNC_RUN_ABORT_SKIPPED accountId={} runId={} reason=account_missing", accountId, runId);
            return false;
        }
        if (!account.isSyncingNow() || runId == null || !runId.equals(account.getSyncRunId())) {
            log.info("SYNC_RUN_ABORT_SKIPPED accountId={} runId={} activeRunId={} syncing={}",
                    accountId, runId, account.getSyncRunId(), account.getSyncing());
            return false;
        }
        syncAccountMapper.markAborted(accountId, runId, LocalDateTime.now(), reason,
                SyncRunStatus.ABORTED.name());
        int cleared = syncBatchLedgerMapper.deleteByAccount(accountId);
        log.warn("SYNC_RUN_ABORTED accountId={} runId={} status={} ledgerRowsCleared={} reason={}",
                accountId, runId, SyncRunStatus.ABORTED, cleared, reason);
        return true;
    }
}
