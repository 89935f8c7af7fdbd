package com.example.librarysync.domain.enumtype;

public enum SyncRunStatus {
    RUNNING,
    SUCCEEDED,
    ABORTED
}
