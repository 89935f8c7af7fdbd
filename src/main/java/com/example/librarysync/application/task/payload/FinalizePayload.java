package com.example.librarysync.application.task.payload;

import com.example.librarysync.application.task.SyncTaskPayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinalizePayload implements SyncTaskPayload {

    private Long accountId;

    private String runId;

    /** Ordinal of the terminal batch, i.e. the number of batches the run produced. */
    private int expectedBatches;

    private boolean fullResync;

    private int attempt;
}
