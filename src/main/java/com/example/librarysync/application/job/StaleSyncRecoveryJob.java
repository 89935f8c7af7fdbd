package com.example.librarysync.application.job;

import com.example.librarysync.application.service.SyncRunAbortService;
import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * A run whose tasks were lost or keep rescheduling would leave the account syncing forever and
 * block every later run. Runs older than the configured timeout are aborted.
 */
@Service
public class StaleSyncRecoveryJob {

    private static final Logger log = LoggerFactory.getLogger(StaleSyncRecoveryJob.class);

    private final AppSyncProperties appSyncProperties;
    private final SyncAccountMapper syncAccountMapper;
    private final SyncRunAbortService syncRunAbortService;

    public StaleSyncRecoveryJob(AppSyncProperties appSyncProperties,
                                SyncAccountMapper syncAccountMapper,
                                SyncRunAbortService syncRunAbortService) {
        this.appSyncProperties = appSyncProperties;
        this.syncAccountMapper = syncAccountMapper;
        this.syncRunAbortService = syncRunAbortService;
    }

    @Scheduled(cron = "${app.sync.stale-run-check-cron:0 */10 * * * ?}")
    public void run() {
        recoverStaleRuns();
    }

    public int recoverStaleRuns() {
        LocalDateTime cutoff = LocalDateTime.now().minusMinutes(appSyncProperties.getStaleRunTimeoutMinutes());
        List<SyncAccountEntity> stale = syncAccountMapper.selectSyncingStartedBefore(cutoff);
        if (stale == null || stale.isEmpty()) {
            return 0;
        }
        int aborted = 0;
        for (SyncAccountEntity account : stale) {
            try {
                boolean done = syncRunAbortService.abort(account.getId(), account.getSyncRunId(),
                        "Run exceeded " + appSyncProperties.getStaleRunTimeoutMinutes()
                                + " minutes, started at " + account.getSyncStartedAt());
                if (done) {
                    aborted++;
                }
            } catch (Exception e) {
                log.warn("Stale run abort failed, accountId={}, runId={}", account.getId(), account.getSyncRunId(), e);
            }
        }
        log.info("Stale sync recovery finished, candidates={}, aborted={}, cutoff={}", stale.size(), aborted, cutoff);
        return aborted;
    }
}
