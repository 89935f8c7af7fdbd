package com.example.librarysync.domain.enumtype;

public enum SyncTaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    DEAD
}
