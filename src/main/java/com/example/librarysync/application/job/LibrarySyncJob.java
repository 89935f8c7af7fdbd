package com.example.librarysync.application.job;

import com.example.librarysync.application.service.LibrarySyncService;
import com.example.librarysync.common.config.AppSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class LibrarySyncJob {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncJob.class);

    private final AppSyncProperties appSyncProperties;
    private final LibrarySyncService librarySyncService;

    public LibrarySyncJob(AppSyncProperties appSyncProperties, LibrarySyncService librarySyncService) {
        this.appSyncProperties = appSyncProperties;
        this.librarySyncService = librarySyncService;
    }

    @Scheduled(cron = "${app.sync.cron:0 0 0 * * ?}")
    public void run() {
        log.info("Library sync schedule triggered, cron={}", appSyncProperties.getCron());
        try {
            int started = librarySyncService.startAllEligible();
            log.info("Library sync schedule finished, started={}", started);
        } catch (Exception e) {
            log.warn("Library sync schedule failed unexpectedly", e);
        }
    }
}
