package com.example.librarysync.application.service;

import com.example.librarysync.api.response.SyncStatusResponse;
import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.PaginatePayload;
import com.example.librarysync.common.config.AppSecurityProperties;
import com.example.librarysync.common.exception.BusinessException;
import com.example.librarysync.common.util.AesCryptoUtil;
import com.example.librarysync.domain.enumtype.SyncRunStatus;
import com.example.librarysync.domain.enumtype.SyncStartResult;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import com.example.librarysync.infrastructure.persistence.mapper.SyncBatchLedgerMapper;
import com.example.librarysync.infrastructure.persistence.mapper.TrackMapper;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Starts sync runs. Each start is its own transaction: the account row is locked, the run state
 * reset and the first {@code PAGINATE} task enqueued together.
 */
@Service
public class LibrarySyncService {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncService.class);

    private final SyncAccountMapper syncAccountMapper;
    private final SyncBatchLedgerMapper syncBatchLedgerMapper;
    private final TrackMapper trackMapper;
    private final SyncTaskQueue syncTaskQueue;
    private final AppSecurityProperties appSecurityProperties;
    private final TransactionTemplate transactionTemplate;

    public LibrarySyncService(SyncAccountMapper syncAccountMapper,
                              SyncBatchLedgerMapper syncBatchLedgerMapper,
                              TrackMapper trackMapper,
                              SyncTaskQueue syncTaskQueue,
                              AppSecurityProperties appSecurityProperties,
                              PlatformTransactionManager transactionManager) {
        this.syncAccountMapper = syncAccountMapper;
        this.syncBatchLedgerMapper = syncBatchLedgerMapper;
        this.trackMapper = trackMapper;
        this.syncTaskQueue = syncTaskQueue;
        this.appSecurityProperties = appSecurityProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public SyncStartResult startSync(Long accountId) {
        SyncStartResult result = transactionTemplate.execute(status -> doStartSync(accountId));
        return result == null ? SyncStartResult.ALREADY_SYNCING : result;
    }

    /**
     * Starts every enabled account that is not already syncing.
     *
     * @return number of runs started
     */
    public int startAllEligible() {
        List<Long> accountIds = syncAccountMapper.selectIdleEnabledIds();
        if (accountIds == null || accountIds.isEmpty()) {
            log.debug("No idle enabled sync account");
            return 0;
        }
        int started = 0;
        for (Long accountId : accountIds) {
            try {
                if (startSync(accountId) == SyncStartResult.STARTED) {
                    started++;
                }
            } catch (RuntimeException e) {
                log.warn("SYNC_RUN_START_FAILED accountId={}", accountId, e);
            }
        }
        log.info("SYNC_RUNS_TRIGGERED candidates={} started={}", accountIds.size(), started);
        return started;
    }

    public SyncStatusResponse getStatus(Long accountId) {
        SyncAccountEntity account = syncAccountMapper.selectById(accountId);
        if (account == null) {
            throw new BusinessException("404", "Sync account not found");
        }
        SyncStatusResponse response = new SyncStatusResponse();
        response.setAccountId(account.getId());
        response.setName(account.getName());
        response.setSyncing(account.isSyncingNow());
        response.setRunId(account.getSyncRunId());
        response.setLastSyncStatus(account.getLastSyncStatus());
        response.setSyncStartedAt(account.getSyncStartedAt());
        response.setSyncFinishedAt(account.getSyncFinishedAt());
        response.setLastSuccessfulSyncAt(account.getLastSuccessfulSyncAt());
        response.setTrackCount(account.getTrackCount());
        response.setDeletedCount(account.getDeletedCount());
        response.setMergedCount(account.getMergedCount());
        response.setMeanDurationMs(account.getMeanDurationMs());
        response.setLastError(account.getLastError());
        response.setStoredTrackCount(trackMapper.countByAccount(accountId));
        return response;
    }

    SyncStartResult doStartSync(Long accountId) {
        SyncAccountEntity account = syncAccountMapper.selectByIdForUpdate(accountId);
        if (account == null) {
            throw new BusinessException("404", "Sync account not found");
        }
        if (!account.isEnabledAccount()) {
            log.info("SYNC_RUN_SKIPPED accountId={} reason=disabled", accountId);
            return SyncStartResult.DISABLED;
        }
        if (account.isSyncingNow()) {
            log.info("SYNC_RUN_SKIPPED accountId={} reason=already_syncing runId={}",
                    accountId, account.getSyncRunId());
            return SyncStartResult.ALREADY_SYNCING;
        }

        Long watermarkMicros = toEpochMicros(account.getLastSuccessfulSyncAt());
        String runId = UUID.randomUUID().toString().replace("-", "");
        LocalDateTime startedAt = LocalDateTime.now();
        if (syncAccountMapper.markSyncStarted(accountId, runId, startedAt, SyncRunStatus.RUNNING.name()) != 1) {
            return SyncStartResult.ALREADY_SYNCING;
        }
        syncBatchLedgerMapper.deleteByAccount(accountId);

        String passwordEnc = AesCryptoUtil.reencrypt(account.getPasswordEnc(), appSecurityProperties.getEncryptKey());
        syncTaskQueue.enqueue(SyncTaskType.PAGINATE,
                new PaginatePayload(accountId, runId, watermarkMicros, passwordEnc, null, 1, 0L));
        log.info("SYNC_RUN_STARTED accountId={} runId={} mode={} watermark={}",
                accountId, runId, watermarkMicros == null ? "FULL" : "INCREMENTAL", account.getLastSuccessfulSyncAt());
        return SyncStartResult.STARTED;
    }

    /**
     * Run timestamps are local wall-clock; catalog timestamps are epoch microseconds.
     */
    static Long toEpochMicros(LocalDateTime time) {
        if (time == null) {
            return null;
        }
        Instant instant = time.atZone(ZoneId.systemDefault()).toInstant();
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }
}
