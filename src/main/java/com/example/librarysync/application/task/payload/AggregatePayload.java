package com.example.librarysync.application.task.payload;

import com.example.librarysync.application.task.SyncTaskPayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AggregatePayload implements SyncTaskPayload {

    private Long accountId;

    private String runId;

    private int trackDelta;

    /** Decimal string of the product of the batch's retained durations. */
    private String partialProduct;

    private String fingerprint;

    private boolean lastPage;

    private int batchNum;

    private int numDeletes;

    private int numMerges;

    /** The run has no watermark, so untouched tracks are swept after finalization. */
    private boolean fullResync;
}
