package com.example.librarysync.domain.enumtype;

public enum SyncStartResult {
    STARTED,
    ALREADY_SYNCING,
    DISABLED
}
