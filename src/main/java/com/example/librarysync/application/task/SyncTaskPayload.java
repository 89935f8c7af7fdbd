package com.example.librarysync.application.task;

/**
 * Every task belongs to one run of one account; the worker uses this to abort the run when the
 * task is dead-lettered.
 */
public interface SyncTaskPayload {

    Long getAccountId();

    String getRunId();
}
