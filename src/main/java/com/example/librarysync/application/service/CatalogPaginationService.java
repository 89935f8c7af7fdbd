package com.example.librarysync.application.service;

import com.example.librarysync.application.task.SyncTaskHandler;
import com.example.librarysync.application.task.SyncTaskQueue;
import com.example.librarysync.application.task.payload.LoadBatchPayload;
import com.example.librarysync.application.task.payload.PaginatePayload;
import com.example.librarysync.common.config.AppSecurityProperties;
import com.example.librarysync.common.config.AppSyncProperties;
import com.example.librarysync.common.util.AesCryptoUtil;
import com.example.librarysync.domain.enumtype.SyncTaskType;
import com.example.librarysync.domain.model.CatalogCredentials;
import com.example.librarysync.domain.model.CatalogPage;
import com.example.librarysync.domain.model.CatalogSession;
import com.example.librarysync.infrastructure.catalog.CatalogClient;
import com.example.librarysync.infrastructure.catalog.CredentialProvider;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles {@code PAGINATE}: walks a bounded chunk of catalog pages in one session and turns each
 * page into a {@code LOAD_BATCH} task. When the chunk ends before the catalog does, the walk
 * continues in a fresh {@code PAGINATE} task with its own session.
 */
@Service
public class CatalogPaginationService implements SyncTaskHandler<PaginatePayload> {

    private static final Logger log = LoggerFactory.getLogger(CatalogPaginationService.class);

    private final CatalogClient catalogClient;
    private final CredentialProvider credentialProvider;
    private final SyncAccountMapper syncAccountMapper;
    private final SyncTaskQueue syncTaskQueue;
    private final AppSyncProperties appSyncProperties;
    private final AppSecurityProperties appSecurityProperties;

    public CatalogPaginationService(CatalogClient catalogClient,
                                    CredentialProvider credentialProvider,
                                    SyncAccountMapper syncAccountMapper,
                                    SyncTaskQueue syncTaskQueue,
                                    AppSyncProperties appSyncProperties,
                                    AppSecurityProperties appSecurityProperties) {
        this.catalogClient = catalogClient;
        this.credentialProvider = credentialProvider;
        this.syncAccountMapper = syncAccountMapper;
        this.syncTaskQueue = syncTaskQueue;
        this.appSyncProperties = appSyncProperties;
        this.appSecurityProperties = appSecurityProperties;
    }

    @Override
    public SyncTaskType getTaskType() {
        return SyncTaskType.PAGINATE;
    }

    @Override
    public Class<PaginatePayload> getPayloadType() {
        return PaginatePayload.class;
    }

    @Override
    public void handle(PaginatePayload payload) {
        Long accountId = payload.getAccountId();
        SyncAccountEntity account = syncAccountMapper.selectById(accountId);
        if (account == null || !account.isSyncingNow() || !payload.getRunId().equals(account.getSyncRunId())) {
            log.info("SYNC_PAGINATE_STALE accountId={} runId={}", accountId, payload.getRunId());
            return;
        }

        CatalogCredentials credentials = credentialProvider.credentialsFor(accountId, payload.getPasswordEnc());
        CatalogSession session = catalogClient.openSession(credentials);
        try {
            paginate(session, payload);
        } finally {
            catalogClient.closeSession(session);
        }
    }

    private void paginate(CatalogSession session, PaginatePayload payload) {
        int pageSize = Math.max(1, appSyncProperties.getPageSize());
        int pageLimit = Math.max(1, appSyncProperties.getPagesPerInvocation());
        String token = payload.getContinuationToken();
        int batchNum = Math.max(1, payload.getNextBatchNum());
        long recordsSeen = payload.getRecordsSeen();

        for (int fetched = 0; fetched < pageLimit; fetched++) {
            CatalogPage page = catalogClient.fetchPage(session, token, pageSize);
            boolean lastPage = page.isLast();
            syncTaskQueue.enqueue(SyncTaskType.LOAD_BATCH, new LoadBatchPayload(
                    payload.getAccountId(),
                    payload.getRunId(),
                    payload.getWatermarkMicros(),
                    page.getRecords(),
                    batchNum,
                    lastPage));
            recordsSeen += page.getRecords().size();
            if (lastPage) {
                log.info("SYNC_PAGINATION_COMPLETE accountId={} runId={} batches={} records={}",
                        payload.getAccountId(), payload.getRunId(), batchNum, recordsSeen);
                return;
            }
            batchNum++;
            token = page.getNextToken();
        }

        PaginatePayload next = new PaginatePayload(
                payload.getAccountId(),
                payload.getRunId(),
                payload.getWatermarkMicros(),
                AesCryptoUtil.reencrypt(payload.getPasswordEnc(), appSecurityProperties.getEncryptKey()),
                token,
                batchNum,
                recordsSeen);
        syncTaskQueue.enqueue(SyncTaskType.PAGINATE, next);
        log.info("SYNC_PAGINATION_CONTINUED accountId={} runId={} nextBatchNum={} records={}",
                payload.getAccountId(), payload.getRunId(), batchNum, recordsSeen);
    }
}
