package com.example.librarysync.api.response;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncStatusResponse {

    private Long accountId;

    private String name;

    private boolean syncing;

    private String runId;

    private String lastSyncStatus;

    private LocalDateTime syncStartedAt;

    private LocalDateTime syncFinishedAt;

    private LocalDateTime lastSuccessfulSyncAt;

    private Long trackCount;

    private Long deletedCount;

    private Long mergedCount;

    private Long meanDurationMs;

    private String lastError;

    /** Rows currently in the track table, as opposed to the run counters above. */
    private long storedTrackCount;
}
