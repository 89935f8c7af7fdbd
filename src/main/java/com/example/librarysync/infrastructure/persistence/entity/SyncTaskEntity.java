package com.example.librarysync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncTaskEntity {

    private Long id;

    private String queueName;

    private String taskType;

    private String payload;

    private String status;

    private Integer attempts;

    private Integer maxAttempts;

    private LocalDateTime availableAt;

    private String lockedBy;

    private LocalDateTime lockedUntil;

    private String lastError;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
