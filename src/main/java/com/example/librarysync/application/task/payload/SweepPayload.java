package com.example.librarysync.application.task.payload;

import com.example.librarysync.application.task.SyncTaskPayload;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SweepPayload implements SyncTaskPayload {

    private Long accountId;

    private String runId;

    /** Tracks last touched before this instant were not seen by the run. */
    private LocalDateTime touchedBefore;
}
