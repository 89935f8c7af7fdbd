package com.example.librarysync.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService syncTaskExecutor;
    private ExecutorService batchWriteExecutor;

    /**
     * Runs claimed queue tasks. The queue is bounded by the claim size, so a rejected
     * submission only means the task stays leased until the lease runs out.
     */
    @Bean
    public ExecutorService syncTaskExecutor(AppSyncProperties appSyncProperties) {
        int core = Math.max(1, appSyncProperties.getWorkerThreadCount());
        int queueSize = Math.max(core, appSyncProperties.getClaimBatchSize());
        this.syncTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("sync-task-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.syncTaskExecutor;
    }

    @Bean
    public ExecutorService batchWriteExecutor(AppSyncProperties appSyncProperties) {
        int threads = Math.max(2, appSyncProperties.getBatchWriteThreadCount());
        this.batchWriteExecutor = Executors.newFixedThreadPool(threads, new NamedThreadFactory("batch-write-"));
        return this.batchWriteExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (syncTaskExecutor != null) {
            syncTaskExecutor.shutdown();
        }
        if (batchWriteExecutor != null) {
            batchWriteExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
