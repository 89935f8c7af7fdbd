package com.example.librarysync.application.task;

import com.example.librarysync.domain.enumtype.SyncTaskType;

public interface SyncTaskHandler<P extends SyncTaskPayload> {

    SyncTaskType getTaskType();

    Class<P> getPayloadType();

    /**
     * Runs one delivery of a task. Handlers must tolerate redelivery of the same payload; any
     * exception sends the task back to the queue for retry or dead-lettering.
     */
    void handle(P payload);
}
