package com.example.librarysync.domain.enumtype;

public enum SyncTaskType {
    PAGINATE,
    LOAD_BATCH,
    AGGREGATE,
    FINALIZE,
    SWEEP
}
