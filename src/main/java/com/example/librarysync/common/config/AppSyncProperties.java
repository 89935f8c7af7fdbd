package com.example.librarysync.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    private String cron = "0 0 0 * * ?";

    /**
     * Records requested per catalog page.
     */
    private int pageSize = 100;

    /**
     * Pages fetched by one pagination task before it hands over to a fresh task.
     */
    private int pagesPerInvocation = 20;

    private String queueName = "lib-upd";

    private long pollIntervalMs = 1000;

    private int claimBatchSize = 16;

    private int workerThreadCount = 4;

    /**
     * Threads issuing the concurrent upsert/delete writes of one batch.
     */
    private int batchWriteThreadCount = 4;

    /**
     * A RUNNING task whose lease expired is delivered again.
     */
    private int leaseSeconds = 300;

    private int maxAttempts = 8;

    private long retryBackoffMs = 2000;

    private long retryBackoffMaxMs = 300000;

    private long finalizeRetryDelayMs = 5000;

    private int sweepBatchSize = 750;

    /**
     * Runs still syncing after this many minutes are aborted by the recovery job.
     */
    private int staleRunTimeoutMinutes = 360;

    private String staleRunCheckCron = "0 */10 * * * ?";

    private int taskRetentionHours = 72;

    private String taskRetentionCron = "0 30 * * * ?";
}
