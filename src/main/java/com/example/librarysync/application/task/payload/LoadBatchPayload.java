package com.example.librarysync.application.task.payload;

import com.example.librarysync.application.task.SyncTaskPayload;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadBatchPayload implements SyncTaskPayload {

    private Long accountId;

    private String runId;

    private Long watermarkMicros;

    private List<Map<String, Object>> records;

    private int batchNum;

    private boolean lastPage;
}
