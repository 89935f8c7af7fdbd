package com.example.librarysync.application.service;

import com.example.librarysync.application.task.SyncTaskHandler;
import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.SweepPayload;
import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.infrastructure.persistence.mapper.TrackMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles {@code SWEEP}. After a full resync the catalog is authoritative, so tracks the run did
 * not touch are gone upstream and are removed in bounded chunks.
 */
@Service
public class LibraryJanitorService implements SyncTaskHandler<SweepPayload> {

    private static final Logger log = LoggerFactory.getLogger(LibraryJanitorService.class);

    private final TrackMapper trackMapper;
    private final SyncTaskQueue syncTaskQueue;
    private final AppSyncProperties appSyncProperties;

    public LibraryJanitorService(TrackMapper trackMapper,
                                 SyncTaskQueue syncTaskQueue,
                                 AppSyncProperties appSyncProperties) {
        this.trackMapper = trackMapper;
        this.syncTaskQueue = syncTaskQueue;
        this.appSyncProperties = appSyncProperties;
    }

    @Override
    public SyncTaskType getTaskType() {
        return SyncTaskType.SWEEP;
    }

    @Override
    public Class<SweepPayload> getPayloadType() {
        return SweepPayload.class;
    }

    @Override
    public void handle(SweepPayload payload) {
        if (payload.getTouchedBefore() == null) {
            log.warn("SYNC_SWEEP_SKIPPED accountId={} runId={} reason=no_cutoff",
                    payload.getAccountId(), payload.getRunId());
            return;
        }
        int limit = Math.max(1, appSyncProperties.getSweepBatchSize());
        int deleted = trackMapper.deleteUntouchedBefore(payload.getAccountId(), payload.getTouchedBefore(), limit);
        log.info("SYNC_SWEEP_CHUNK accountId={} runId={} deleted={} touchedBefore={}",
                payload.getAccountId(), payload.getRunId(), deleted, payload.getTouchedBefore());
        if (deleted >= limit) {
            syncTaskQueue.enqueue(SyncTaskType.SWEEP, payload);
        }
    }
}
