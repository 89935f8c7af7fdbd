package com.example.librarysync.application.job;

import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.infrastructure.persistence.mapper.SyncTaskMapper;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Purges succeeded tasks. Dead tasks are kept for inspection.
 */
@Service
public class SyncTaskRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(SyncTaskRetentionJob.class);

    private final AppSyncProperties appSyncProperties;
    private final SyncTaskMapper syncTaskMapper;

    public SyncTaskRetentionJob(AppSyncProperties appSyncProperties, SyncTaskMapper syncTaskMapper) {
        this.appSyncProperties = appSyncProperties;
        this.syncTaskMapper = syncTaskMapper;
    }

    @Scheduled(cron = "${app.sync.task-retention-cron:0 30 * * * ?}")
    public void purge() {
        purgeSucceeded();
    }

    /**
     * @return number of task rows removed
     */
    public int purgeSucceeded() {
        LocalDateTime before = LocalDateTime.now().minusHours(appSyncProperties.getTaskRetentionHours());
        int removed = syncTaskMapper.deleteSucceededBefore(before);
        if (removed > 0) {
            log.info("Succeeded sync tasks purged, removed={}, before={}", removed, before);
        }
        return removed;
    }
}
