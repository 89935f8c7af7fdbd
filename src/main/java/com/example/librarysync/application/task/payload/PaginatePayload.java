package com.example.librarysync.application.task.payload;

import com.example.librarysync.application.task.SyncTaskPayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resumable pagination state. Each pagination task opens its own session from the encrypted
 * password carried here and hands an updated copy to its successor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaginatePayload implements SyncTaskPayload {

    private Long accountId;

    private String runId;

    /** Microseconds since epoch; null for a full resync. */
    private Long watermarkMicros;

    private String passwordEnc;

    private String continuationToken;

    private int nextBatchNum;

    private long recordsSeen;
}
