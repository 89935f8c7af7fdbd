package com.example.librarysync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncBatchLedgerEntity {

    private Long id;

    private Long accountId;

    private String runId;

    private String fingerprint;

    private Integer batchNum;

    private String partialProduct;

    private Integer trackDelta;

    private LocalDateTime createdAt;
}
