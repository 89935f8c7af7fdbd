package com.example.librarysync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncAccountEntity {

    private Long id;

    private String name;

    private String catalogUsername;

    private String passwordEnc;

    private Boolean enabled;

    private Boolean syncing;

    private String syncRunId;

    private LocalDateTime syncStartedAt;

    private LocalDateTime syncFinishedAt;

    private LocalDateTime lastSuccessfulSyncAt;

    private Long trackCount;

    private Long deletedCount;

    private Long mergedCount;

    private Long meanDurationMs;

    private String lastSyncStatus;

    private String lastError;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isSyncingNow() {
        return Boolean.TRUE.equals(syncing);
    }

    public boolean isEnabledAccount() {
        return Boolean.TRUE.equals(enabled);
    }
}
